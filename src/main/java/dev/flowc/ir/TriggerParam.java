package dev.flowc.ir;

/**
 * Shape of the second handler parameter, derived from the trigger kind.
 */
public enum TriggerParam {
    NONE,
    CRON_TRIGGER,
    HTTP_REQUEST,
    EVM_LOG
}
