package io.llmbridge.core.coherency;

import io.llmbridge.core.error.ProviderException;
import io.llmbridge.core.model.CanonicalRequest;
import io.llmbridge.core.model.LlmResponse;
import io.llmbridge.core.model.StandardizedResponse;
import io.llmbridge.core.provider.LlmProvider;
import io.llmbridge.core.provider.ProviderRegistry;
import io.llmbridge.core.provider.SubProviderDirectory;
import io.llmbridge.core.retry.CancellationToken;
import io.llmbridge.core.retry.RetryOrchestrator;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a prompt suite against a model and reports which providers (or gateway sub-providers)
 * answer coherently. Sub-providers are tested in parallel on a fixed pool; prompts for one
 * sub-provider run in order and stop at the first failure. Results are merged on the calling
 * thread only.
 */
public final class CoherencyTester {
    private static final Logger LOG = LoggerFactory.getLogger(CoherencyTester.class);

    private final ProviderRegistry registry;
    private final RetryOrchestrator orchestrator;
    private final ResponseJudge judge;

    public CoherencyTester(ProviderRegistry registry, RetryOrchestrator orchestrator) {
        this(registry, orchestrator, null);
    }

    public CoherencyTester(ProviderRegistry registry, RetryOrchestrator orchestrator, ResponseJudge judge) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.judge = judge;
    }

    public CoherencyReport runCoherencyTests(
        String targetModelId,
        String targetProviderName,
        int numWorkers,
        RequestOverrides overrides,
        boolean verbose
    ) {
        return run(new CoherencyRun(targetModelId, targetProviderName, numWorkers, overrides, verbose, null, null));
    }

    public CoherencyReport run(CoherencyRun run) {
        return run(run, CancellationToken.create());
    }

    public CoherencyReport run(CoherencyRun run, CancellationToken token) {
        Objects.requireNonNull(run, "run must not be null");
        Objects.requireNonNull(token, "token must not be null");
        LlmProvider target = registry.require(run.targetProviderName());
        boolean routing = target.supportsRouting() && target instanceof SubProviderDirectory;
        if (!routing && !run.allowedSubProviders().isEmpty()) {
            throw new IllegalArgumentException(
                "allowedSubProviders is only supported for routing providers, not '" + target.name() + "'"
            );
        }

        if (!routing) {
            LOG.info("Running {} coherency prompt(s) against {} / {}", run.suite().size(), target.name(), run.targetModelId());
            CoherencyResult result = runTarget(target, null, run, token);
            logSummary(List.of(result));
            return new CoherencyReport(result.passed(), Set.of(), List.of(result));
        }

        List<String> subProviders = resolveSubProviders((SubProviderDirectory) target, run);
        if (subProviders.isEmpty()) {
            LOG.warn("No sub-providers serve {} on {}", run.targetModelId(), target.name());
            return new CoherencyReport(false, Set.of(), List.of());
        }
        LOG.info(
            "Testing {} sub-provider(s) of {} for {} with {} worker(s): {}",
            subProviders.size(),
            target.name(),
            run.targetModelId(),
            run.numWorkers(),
            subProviders
        );

        List<CoherencyResult> results = runParallel(target, subProviders, run, token);
        Set<String> failed = new TreeSet<>();
        boolean anyPassed = false;
        for (CoherencyResult result : results) {
            if (result.passed()) {
                anyPassed = true;
            } else {
                failed.add(result.subProviderName());
            }
        }
        logSummary(results);
        return new CoherencyReport(anyPassed, failed, results);
    }

    private List<String> resolveSubProviders(SubProviderDirectory directory, CoherencyRun run) {
        List<String> enumerated;
        try {
            enumerated = directory.listSubProviders(run.targetModelId());
        } catch (ProviderException e) {
            throw new CoherencyException(
                "Failed to list sub-providers for " + run.targetModelId() + ": " + e.getMessage(),
                e
            );
        }
        List<String> forced = run.allowedSubProviders();
        if (forced.isEmpty()) {
            return enumerated;
        }
        if (enumerated.isEmpty()) {
            LOG.warn("Endpoint listing for {} was empty; using forced sub-providers {}", run.targetModelId(), forced);
            return new ArrayList<>(new LinkedHashSet<>(forced));
        }
        Set<String> allowed = new HashSet<>();
        for (String name : forced) {
            allowed.add(name.trim().toLowerCase(Locale.ROOT));
        }
        List<String> selected = new ArrayList<>();
        for (String name : enumerated) {
            if (allowed.contains(name.trim().toLowerCase(Locale.ROOT))) {
                selected.add(name);
            }
        }
        if (selected.isEmpty()) {
            LOG.warn("None of the forced sub-providers {} serve {}", forced, run.targetModelId());
        }
        return selected;
    }

    private List<CoherencyResult> runParallel(
        LlmProvider target,
        List<String> subProviders,
        CoherencyRun run,
        CancellationToken token
    ) {
        int threads = Math.min(run.numWorkers(), subProviders.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads, workerThreads());
        CompletionService<CoherencyResult> completion = new ExecutorCompletionService<>(pool);
        Map<Future<CoherencyResult>, String> submitted = new HashMap<>();
        for (String subProvider : subProviders) {
            submitted.put(completion.submit(() -> runTarget(target, subProvider, run, token)), subProvider);
        }

        List<CoherencyResult> results = new ArrayList<>();
        Set<String> pending = new LinkedHashSet<>(subProviders);
        try {
            for (int i = 0; i < subProviders.size(); i++) {
                Future<CoherencyResult> future = completion.take();
                String subProvider = submitted.get(future);
                pending.remove(subProvider);
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.error("Coherency task for {} failed", subProvider, cause);
                    results.add(new CoherencyResult(target.name(), subProvider, false, List.of("Exception: " + cause)));
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            token.cancel();
            for (String subProvider : pending) {
                results.add(new CoherencyResult(target.name(), subProvider, false, List.of("cancelled before completion")));
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private CoherencyResult runTarget(LlmProvider target, String subProvider, CoherencyRun run, CancellationToken token) {
        String label = subProvider == null ? target.name() : target.name() + "/" + subProvider;
        List<String> failures = new ArrayList<>();
        for (CoherencyPrompt prompt : run.suite().prompts()) {
            if (token.shouldStop()) {
                failures.add(prompt.id() + ": cancelled");
                break;
            }
            List<String> promptFailures = checkPrompt(target, subProvider, prompt, run, token);
            if (!promptFailures.isEmpty()) {
                failures.addAll(promptFailures);
                LOG.info("[{}] FAIL {}: {}", label, prompt.id(), promptFailures);
                break;
            }
            if (run.verbose()) {
                LOG.info("[{}] PASS {}", label, prompt.id());
            } else {
                LOG.debug("[{}] PASS {}", label, prompt.id());
            }
        }
        return new CoherencyResult(target.name(), subProvider, failures.isEmpty(), failures);
    }

    private List<String> checkPrompt(
        LlmProvider target,
        String subProvider,
        CoherencyPrompt prompt,
        CoherencyRun run,
        CancellationToken token
    ) {
        CanonicalRequest request = run.overrides().apply(CanonicalRequest.ofPrompt(run.targetModelId(), prompt.prompt()));
        if (subProvider != null) {
            request = request.withAllowList(List.of(subProvider));
        }

        LlmResponse response = orchestrator.execute(target, request, token);
        if (!response.success()) {
            return List.of(prompt.id() + ": request failed (" + response.errorInfo().type() + "): " + response.errorInfo().message());
        }

        StandardizedResponse answer = response.standardizedResponse();
        List<String> failures = new ArrayList<>();
        if ("content_filter".equals(answer.finishReason()) || "error".equals(answer.finishReason())) {
            failures.add(prompt.id() + ": response stopped due to: " + answer.finishReason());
        } else if (answer.content().isBlank()) {
            failures.add(prompt.id() + ": empty response");
        }

        if (run.overrides().reasoning() != null) {
            boolean expected = run.overrides().reasoning().enabled();
            boolean actual = ReasoningDetector.hasReasoning(response);
            if (expected && !actual) {
                failures.add(prompt.id() + ": Reasoning expected but not present");
            } else if (!expected && actual) {
                failures.add(prompt.id() + ": Reasoning not expected but present");
            }
        }

        if (failures.isEmpty() && judge != null) {
            String verdict = judge.judge(prompt.prompt(), answer.content(), token);
            if (verdict != null) {
                failures.add(prompt.id() + ": " + verdict);
            }
        }
        return failures;
    }

    private void logSummary(List<CoherencyResult> results) {
        for (CoherencyResult result : results) {
            if (result.passed()) {
                LOG.info("{}: PASSED", result.label());
            } else {
                LOG.info("{}: FAILED {}", result.label(), result.failures());
            }
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "coherency-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
