package me.golemcore.runtime.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraceEventDto {
    private int step;
    private long sequence;
    private String kind;
    private Map<String, Object> payload;
    private String timestamp;
}
