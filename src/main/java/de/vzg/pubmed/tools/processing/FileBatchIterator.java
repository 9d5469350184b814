package de.vzg.pubmed.tools.processing;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Function;

import de.vzg.pubmed.tools.model.Article;

/**
 * Feeds files to a worker pool and hands back one file's articles at a time. At most {@code window} files
 * are queued or finished but not yet consumed, which bounds memory to a few files' worth of articles.
 */
class FileBatchIterator implements Iterator<List<Article>> {

    private final List<Path> paths;
    private final ExecutorService executor;
    private final int window;
    private final boolean ordered;
    private final Function<Path, List<Article>> task;

    private final Deque<Future<List<Article>>> pendingInOrder = new ArrayDeque<>();
    private final CompletionService<List<Article>> completionService;
    private int inFlight;
    private int nextIndex;

    FileBatchIterator(List<Path> paths, ExecutorService executor, int window, boolean ordered,
        Function<Path, List<Article>> task) {
        this.paths = paths;
        this.executor = executor;
        this.window = Math.max(1, window);
        this.ordered = ordered;
        this.task = task;
        this.completionService = ordered ? null : new ExecutorCompletionService<>(executor);
    }

    private void fill() {
        while (inFlight < window && nextIndex < paths.size()) {
            Path path = paths.get(nextIndex++);
            if (ordered) {
                pendingInOrder.add(executor.submit(() -> task.apply(path)));
            } else {
                completionService.submit(() -> task.apply(path));
            }
            inFlight++;
        }
    }

    @Override
    public boolean hasNext() {
        fill();
        boolean hasNext = inFlight > 0;
        if (!hasNext) {
            executor.shutdown();
        }
        return hasNext;
    }

    @Override
    public List<Article> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Future<List<Article>> future;
        try {
            future = ordered ? pendingInOrder.poll() : completionService.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("Interrupted while waiting for a file", e);
        }
        inFlight--;
        return await(future);
    }

    private List<Article> await(Future<List<Article>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            throw new IllegalStateException("Interrupted while waiting for a file", e);
        } catch (ExecutionException e) {
            executor.shutdownNow();
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            if (cause instanceof IOException ioException) {
                throw new UncheckedIOException(ioException);
            }
            throw new IllegalStateException(cause);
        }
    }
}
