package com.oracle.thinking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {

    private int historySize;

    private int historyCapacity;

    private int branchCount;

    private int sessionCount;

    /**
     * Timestamp of the oldest retained thought, null when empty
     */
    private Long oldestThought;

    private Long newestThought;
}
