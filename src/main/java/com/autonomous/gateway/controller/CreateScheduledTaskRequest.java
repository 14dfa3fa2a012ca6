package com.autonomous.gateway.controller;

import lombok.Data;

@Data
public class CreateScheduledTaskRequest {
    private String title;
    private String taskRequest;
    private long intervalSeconds;
    private boolean executeImmediately;
    private String providerId;
    private String model;
}
