package com.qqsuccubus.livehub.core.notification;

import lombok.Value;

import java.util.List;

@Value
public class NotificationPage {
    List<Notification> data;
    long total;
    int page;
    int limit;
}
