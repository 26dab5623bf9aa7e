package me.golemcore.planner.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResponse {
    private boolean agentDeleted;
    private boolean vectorIndexDeleted;
    private boolean fileDeleted;
    private SessionDto session;
}
