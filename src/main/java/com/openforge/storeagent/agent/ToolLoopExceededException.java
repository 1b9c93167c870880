package com.openforge.storeagent.agent;

public class ToolLoopExceededException extends RuntimeException {

    public ToolLoopExceededException(int maxIterations) {
        super("Stopped after " + maxIterations + " tool rounds without a final answer");
    }
}
