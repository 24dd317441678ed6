package com.company.uptime.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDispatchResult {
    private String reason;
    private int requested;
    private int enqueued;
    private int failed;
}
