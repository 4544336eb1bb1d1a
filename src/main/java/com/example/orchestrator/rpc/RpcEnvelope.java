package com.example.orchestrator.rpc;

/**
 * A message queued on the control loop: the RPC method it came from and the action that
 * applies it.
 */
public record RpcEnvelope(
        String method,
        Runnable action
) {
}
