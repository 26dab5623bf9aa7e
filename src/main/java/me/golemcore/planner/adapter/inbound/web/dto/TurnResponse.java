package me.golemcore.planner.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of one chat turn plus the session as it looks afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResponse {
    private String outcome;
    private String runId;
    private List<String> responses;
    private String error;
    private SessionDto session;
}
