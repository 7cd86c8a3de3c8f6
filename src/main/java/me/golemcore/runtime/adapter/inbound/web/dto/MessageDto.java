package me.golemcore.runtime.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageDto {
    private String role;
    private String content;
    private String toolName;
    private String errorCode;
    private String timestamp;
}
