package me.golemcore.planner.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionDto {
    private String key;
    private String status;
    private String error;
    private String agentId;
    private String vectorIndexId;
    private String uploadedFileId;
    private String threadId;
    private String runId;
    private List<MessageDto> messages;
    private String lastActivity;
    private boolean cleanedUp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MessageDto {
        private String role;
        private String text;
    }
}
