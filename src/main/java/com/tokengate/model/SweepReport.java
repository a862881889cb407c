package com.tokengate.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of one re-verification sweep over all verified members")
public class SweepReport {

    public enum Trigger { SCHEDULED, MANUAL }

    private Trigger trigger;
    private long startedAt;
    private long finishedAt;

    @Schema(description = "True when the sweep did not run because another one was in progress")
    private boolean skipped;

    private int groupsScanned;
    private int usersChecked;
    private int retained;
    private int evicted;

    @Schema(description = "Eviction decisions dropped because the record changed while the balance was fetched")
    private int skippedStale;

    @Schema(description = "Members whose balance could not be fetched or who could not be removed")
    private int errors;
}
