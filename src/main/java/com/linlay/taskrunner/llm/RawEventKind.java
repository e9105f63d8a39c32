package com.linlay.taskrunner.llm;

/**
 * Raw event vocabulary of a reasoning engine. Only the stream adapter interprets these.
 */
public enum RawEventKind {
    CHAT_MODEL_START,
    CHAT_MODEL_STREAM,
    CHAT_MODEL_END,
    TOOL_START,
    TOOL_END,
    CHAIN_END
}
