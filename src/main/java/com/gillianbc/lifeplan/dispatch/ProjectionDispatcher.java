package com.gillianbc.lifeplan.dispatch;

import com.gillianbc.lifeplan.config.ProjectionProperties;
import com.gillianbc.lifeplan.model.Trajectory;
import com.gillianbc.lifeplan.service.ComparisonService;
import com.gillianbc.lifeplan.service.TrajectoryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs projections and comparisons off the caller's thread.
 * <p>
 * The returned future always completes normally; any failure is logged and handed back as an
 * {@link ErrorResponse}. Requests are neither cancelled nor de-duplicated.
 */
@Slf4j
@Service
public class ProjectionDispatcher implements AutoCloseable {

    private final TrajectoryService trajectoryService;
    private final ComparisonService comparisonService;
    private final ExecutorService executor;

    @Autowired
    public ProjectionDispatcher(TrajectoryService trajectoryService, ComparisonService comparisonService,
                                ProjectionProperties properties) {
        this(trajectoryService, comparisonService, Executors.newFixedThreadPool(
                Math.max(1, properties.getDispatcherThreads()), new WorkerThreadFactory()));
    }

    ProjectionDispatcher(TrajectoryService trajectoryService, ComparisonService comparisonService,
                         ExecutorService executor) {
        this.trajectoryService = trajectoryService;
        this.comparisonService = comparisonService;
        this.executor = executor;
    }

    public CompletableFuture<ProjectionResponse> submit(ProjectionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        try {
            return CompletableFuture.supplyAsync(() -> handle(request), executor)
                    .exceptionally(e -> failed(request, e));
        } catch (RuntimeException e) {
            // rejected after close
            return CompletableFuture.completedFuture(failed(request, e));
        }
    }

    ProjectionResponse handle(ProjectionRequest request) {
        if (request instanceof GenerateRequest) {
            GenerateRequest generate = (GenerateRequest) request;
            return new TrajectoryResponse(trajectoryService.generateTrajectory(generate.getProfile()));
        }
        if (request instanceof GenerateQuickRequest) {
            GenerateQuickRequest quick = (GenerateQuickRequest) request;
            Trajectory trajectory = quick.getYears() == null
                    ? trajectoryService.generateQuickTrajectory(quick.getProfile())
                    : trajectoryService.generateQuickTrajectory(quick.getProfile(), quick.getYears());
            return new TrajectoryResponse(trajectory);
        }
        if (request instanceof CompareRequest) {
            CompareRequest compare = (CompareRequest) request;
            String name = compare.getName() != null ? compare.getName() : ComparisonService.DEFAULT_NAME;
            return new ComparisonResponse(comparisonService.compareTrajectories(
                    compare.getBaseline(), compare.getAlternate(), compare.getChanges(), name));
        }
        throw new IllegalArgumentException("Unsupported request type " + request.getClass().getSimpleName());
    }

    private static ErrorResponse failed(ProjectionRequest request, Throwable e) {
        Throwable cause = e.getCause() != null && e instanceof CompletionException ? e.getCause() : e;
        log.warn("{} failed: {}", request.getClass().getSimpleName(), cause.toString(), cause);
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ErrorResponse(message);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "projection-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
