package com.xpt.storage.record;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Stored bookkeeping of one run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunRecord(int index, String name, boolean completed, Long startedAt, Long finishedAt, String summary) {
}
