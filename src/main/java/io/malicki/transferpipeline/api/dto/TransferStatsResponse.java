package io.malicki.transferpipeline.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransferStatsResponse {

    private Counts counts;
    private BigDecimal totalVolume;   // sum of COMPLETED amounts
    private int queueDepth;
    private int connectedUsers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Counts {
        private long pending;
        private long processing;
        private long completed;
        private long rejected;
        private long failed;
        private long total;
    }
}
