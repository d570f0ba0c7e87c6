package com.oracle.thinking.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One submitted reasoning step. A record is either plain, a revision of an earlier
 * thought, or the start/continuation of a branch diverging from an earlier thought.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThoughtRecord {

    @NotBlank(message = "Thought cannot be blank")
    private String thought;

    @NotNull(message = "Thought number is required")
    @Min(value = 1, message = "Thought number must be at least 1")
    private Integer thoughtNumber;

    @NotNull(message = "Total thoughts is required")
    @Min(value = 1, message = "Total thoughts must be at least 1")
    private Integer totalThoughts;

    @NotNull(message = "nextThoughtNeeded is required")
    private Boolean nextThoughtNeeded;

    @JsonProperty("isRevision")
    private Boolean revision;

    @Min(value = 1, message = "Revised thought number must be at least 1")
    private Integer revisesThought;

    @Min(value = 1, message = "Branch origin thought number must be at least 1")
    private Integer branchFromThought;

    private String branchId;

    private Boolean needsMoreThoughts;

    private String sessionId;

    private Long timestamp;

    @JsonIgnore
    public boolean isBranch() {
        return branchFromThought != null;
    }

    @JsonIgnore
    public boolean isRevisionOf() {
        return Boolean.TRUE.equals(revision) && revisesThought != null;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return !Boolean.TRUE.equals(nextThoughtNeeded);
    }
}
