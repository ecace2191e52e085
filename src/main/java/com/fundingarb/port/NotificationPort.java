package com.fundingarb.port;

/** Outbound operator messages. Returns false when delivery failed or was dropped. */
public interface NotificationPort {

    boolean sendMessage(String text);
}
