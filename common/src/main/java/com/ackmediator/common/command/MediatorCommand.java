package com.ackmediator.common.command;

/**
 * Request routed by the mediator to a consumption or publishing pipeline
 */
public interface MediatorCommand {
}
