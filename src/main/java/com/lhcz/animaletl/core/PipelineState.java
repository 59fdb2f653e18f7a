package com.lhcz.animaletl.core;

/**
 * 流水线运行状态。单条记录失败只计入统计，不会进入单独的失败状态。
 */
public enum PipelineState {
    IDLE,
    RUNNING,
    DRAINING,
    COMPLETED,
    COMPLETED_WITH_ERRORS
}
