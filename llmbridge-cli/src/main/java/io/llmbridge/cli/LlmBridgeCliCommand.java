package io.llmbridge.cli;

import picocli.CommandLine.Command;

@Command(name = "llmbridge", mixinStandardHelpOptions = true, description = "Unified LLM client with retries and coherency testing")
public final class LlmBridgeCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
