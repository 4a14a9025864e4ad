package com.example.triprisk_backend.route;

/** Neither routing engine could produce a route; fatal for the job that asked. */
public class RouteUnavailableException extends RuntimeException {

    public RouteUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public RouteUnavailableException(String message) {
        super(message);
    }
}
