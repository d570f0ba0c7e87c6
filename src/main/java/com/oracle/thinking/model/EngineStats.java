package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EngineStats {

    private StorageStats storage;

    private SecurityStatus security;

    private int activeTrees;

    private int activeSessions;
}
