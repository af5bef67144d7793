package com.qqsuccubus.livehub.socket.notification;

public class NotificationStoreException extends RuntimeException {

    public NotificationStoreException(String message) {
        super(message);
    }

    public NotificationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
