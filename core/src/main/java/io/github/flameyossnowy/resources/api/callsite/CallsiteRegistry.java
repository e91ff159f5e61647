package io.github.flameyossnowy.resources.api.callsite;

import io.github.flameyossnowy.resources.api.meta.Model;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds one {@link Callsite} per model, repository name and signature. Concurrent
 * first lookups of the same triple all receive the instance created by the winner.
 */
public final class CallsiteRegistry {
    private static final StackWalker WALKER = StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE);

    private final Map<CallsiteKey, Callsite> callsites = new ConcurrentHashMap<>();

    public @NotNull Callsite callsite(@NotNull Model model, @NotNull String repositoryName, @NotNull String signature) {
        return callsites.computeIfAbsent(
            new CallsiteKey(model, repositoryName, signature),
            key -> new Callsite(model, repositoryName, signature)
        );
    }

    /**
     * The callsite of the calling line, identified as {@code Class#method:line}.
     */
    public @NotNull Callsite callsite(@NotNull Model model, @NotNull String repositoryName) {
        return callsite(model, repositoryName, callerSignature());
    }

    public @NotNull Callsite callsite(@NotNull Model model) {
        return callsite(model, model.defaultRepositoryName(), callerSignature());
    }

    public @Nullable Callsite get(@NotNull Model model, @NotNull String repositoryName, @NotNull String signature) {
        return callsites.get(new CallsiteKey(model, repositoryName, signature));
    }

    public int size() {
        return callsites.size();
    }

    public void clear() {
        callsites.clear();
    }

    private static String callerSignature() {
        return WALKER.walk(frames -> frames
            .filter(frame -> frame.getDeclaringClass() != CallsiteRegistry.class)
            .findFirst()
            .map(frame -> frame.getClassName() + '#' + frame.getMethodName() + ':' + frame.getLineNumber())
            .orElseThrow(() -> new IllegalStateException("No caller frame")));
    }

    private record CallsiteKey(Model model, String repositoryName, String signature) {
    }
}
