package com.gapfill.ws;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class StatusEvent extends PolygonEvent {

    public static final String CONNECTED = "connected";
    public static final String AUTH_SUCCESS = "auth_success";
    public static final String AUTH_FAILED = "auth_failed";

    private String status;
    private String message;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public boolean isConnected() {
        return CONNECTED.equalsIgnoreCase(status);
    }

    public boolean isAuthFailure() {
        return AUTH_FAILED.equalsIgnoreCase(status);
    }
}
