package me.golemcore.runtime.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunResponse {
    private String sessionId;
    private String status;
    private String stopReason;
    private String finalAnswer;
    private int steps;
    private List<MessageDto> transcript;
}
