package com.rush.agent.model;

import lombok.Value;

@Value
public class SessionMetadata {
    String userQuery;
    SessionType sessionType;
    Priority priority;
}
