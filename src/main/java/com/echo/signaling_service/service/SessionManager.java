package com.echo.signaling_service.service;

import java.util.Set;

public interface SessionManager {

    boolean isOpen(String connectionId);

    Set<String> openConnectionIds();
}
