package io.llmbridge.core.coherency;

import io.llmbridge.core.retry.CancellationToken;

@FunctionalInterface
public interface ResponseJudge {

    /**
     * @return null when the answer is coherent, otherwise a short reason
     */
    String judge(String prompt, String answer, CancellationToken token);
}
