package org.csits.mig.server.constants;

/**
 * 单个加载器处理一批行的结果。
 */
public enum LoaderOutcome {

    SUCCEEDED,

    /**
     * 目标写入可恢复失败，已告警，链继续。
     */
    RECOVERABLE_FAILURE,

    /**
     * 未识别的异常，已记录错误，链继续。
     */
    FAILED
}
