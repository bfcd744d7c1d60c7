package com.starscape.offlineocr.features.ocrjob.app;

import com.starscape.offlineocr.common.config.ArtifactProperties;
import com.starscape.offlineocr.common.config.ProcessingProperties;
import com.starscape.offlineocr.common.exception.ErrorKind;
import com.starscape.offlineocr.common.exception.InvalidInputException;
import com.starscape.offlineocr.common.exception.NotFoundException;
import com.starscape.offlineocr.common.exception.UnsupportedFormatException;
import com.starscape.offlineocr.features.languages.app.ArtifactCache;
import com.starscape.offlineocr.features.languages.domain.LanguageArtifactRegistry;
import com.starscape.offlineocr.features.languages.infra.FileSystemArtifactStore;
import com.starscape.offlineocr.features.ocrjob.domain.ContentClass;
import com.starscape.offlineocr.features.ocrjob.domain.DocumentDecoder;
import com.starscape.offlineocr.features.ocrjob.domain.IntakeDocument;
import com.starscape.offlineocr.features.ocrjob.domain.JobSnapshot;
import com.starscape.offlineocr.features.ocrjob.domain.JobStatus;
import com.starscape.offlineocr.features.ocrjob.domain.PageSource;
import com.starscape.offlineocr.features.ocrjob.domain.ProgressSink;
import com.starscape.offlineocr.features.ocrjob.domain.RecognitionResult;
import com.starscape.offlineocr.features.ocrjob.domain.ResolvedDocument;
import com.starscape.offlineocr.features.ocrjob.domain.Segment;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobProgressed;
import com.starscape.offlineocr.features.ocrjob.domain.events.JobStatusChanged;
import com.starscape.offlineocr.features.ocrjob.infra.format.FormatResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class JobOrchestratorTest {
    
    private static final Executor DIRECT = Runnable::run;
    
    @TempDir
    Path cacheDir;
    
    private final List<Object> events = new CopyOnWriteArrayList<>();
    private volatile Consumer<Object> statusListener = event -> { };
    private final Set<String> unavailableLanguages = ConcurrentHashMap.newKeySet();
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final List<ExecutorService> pools = new ArrayList<>();
    
    private volatile Function<IntakeDocument, ResolvedDocument> decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(1));
    private volatile PageScript pageScript = (pageIndex, sink) -> new RecognitionResult("page " + (pageIndex + 1), 90.0);
    
    private ProcessingProperties processingProperties;
    private ArtifactProperties artifactProperties;
    
    @BeforeEach
    void setUp() {
        processingProperties = new ProcessingProperties();
        artifactProperties = new ArtifactProperties();
        artifactProperties.setCacheDir(cacheDir);
        artifactProperties.setBuiltins(List.of(
            new ArtifactProperties.Builtin("eng", "English"),
            new ArtifactProperties.Builtin("deu", "German"),
            new ArtifactProperties.Builtin("fra", "French")
        ));
    }
    
    @AfterEach
    void tearDown() {
        pools.forEach(ExecutorService::shutdownNow);
    }
    
    @Test
    void shouldRecognizeTwoPageDocumentEndToEnd() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(2));
        pageScript = (pageIndex, sink) -> {
            sink.report(0.5);
            return pageIndex == 0
                ? new RecognitionResult("Hello", 96.2)
                : new RecognitionResult("World", 91.0);
        };
        
        String jobId = orchestrator.submit(document("scan.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        JobSnapshot job = orchestrator.getSnapshot(jobId);
        
        assertTrue(jobId.startsWith("job_"));
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(1.0, job.progress());
        assertEquals(2, job.pageCount());
        assertEquals(List.of(new Segment(0, "Hello", 96.2), new Segment(1, "World", 91.0)), job.segments());
        assertTrue(job.warnings().isEmpty());
        assertNull(job.error());
        assertNotNull(job.completedAt());
        
        assertEquals(
            "--- Page 1 (Confidence: 96.20%) ---\nHello\n\n--- Page 2 (Confidence: 91.00%) ---\nWorld\n",
            new AggregatedTextComposer().compose(job));
    }
    
    @Test
    void shouldPublishMonotonicProgressEndingAtOne() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(4));
        pageScript = (pageIndex, sink) -> {
            sink.report(0.25);
            sink.report(0.75);
            sink.report(0.5);
            return new RecognitionResult("text", 80.0);
        };
        
        String jobId = orchestrator.submit(document("scan.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        
        List<Double> progress = events.stream()
                .filter(JobProgressed.class::isInstance)
                .map(JobProgressed.class::cast)
                .filter(e -> e.jobId().equals(jobId))
                .map(JobProgressed::progress)
                .toList();
        assertFalse(progress.isEmpty());
        for (int i = 1; i < progress.size(); i++) {
            assertTrue(progress.get(i) > progress.get(i - 1), "progress went backwards: " + progress);
        }
        assertEquals(1.0, progress.get(progress.size() - 1));
        
        List<JobStatus> statuses = events.stream()
                .filter(JobStatusChanged.class::isInstance)
                .map(e -> ((JobStatusChanged) e).job().status())
                .toList();
        assertEquals(List.of(JobStatus.PENDING, JobStatus.PROCESSING, JobStatus.COMPLETED), statuses);
    }
    
    @Test
    void shouldRejectEmptyLanguageListWithoutCreatingJob() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        
        assertThrows(InvalidInputException.class,
            () -> orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of()));
        assertThrows(InvalidInputException.class,
            () -> orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of(" ")));
        assertTrue(orchestrator.listSnapshots().isEmpty());
        assertEquals(0, fetchCount.get());
    }
    
    @Test
    void shouldRejectUnknownLanguage() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        
        InvalidInputException error = assertThrows(InvalidInputException.class,
            () -> orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng", "klingon")));
        
        assertTrue(error.getMessage().contains("klingon"));
        assertTrue(orchestrator.listSnapshots().isEmpty());
    }
    
    @Test
    void shouldNormalizeAndDeduplicateLanguages() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("ENG", "deu", "eng"));
        
        assertEquals(List.of("eng", "deu"), orchestrator.getSnapshot(jobId).languages());
    }
    
    @Test
    void shouldKeepGoingWhenOnePageFails() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(3));
        pageScript = (pageIndex, sink) -> {
            if (pageIndex == 1) {
                throw new IllegalStateException("engine crashed");
            }
            return new RecognitionResult("page " + (pageIndex + 1), 88.0);
        };
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("scan.pdf"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(1.0, job.progress());
        assertEquals(List.of(0, 2), job.segments().stream().map(Segment::pageIndex).toList());
        assertEquals(List.of("Page 2 could not be recognized: engine crashed"), job.warnings());
    }
    
    @Test
    void shouldFailWhenEveryPageFailsAndThereIsNoText() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(2));
        pageScript = (pageIndex, sink) -> {
            throw new IOException("model missing");
        };
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("scan.png"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.ERROR, job.status());
        assertEquals(ErrorKind.PAGE_RECOGNITION_FAILED, job.error().kind());
        assertTrue(job.segments().isEmpty());
        assertEquals(2, job.warnings().size());
    }
    
    @Test
    void shouldCompleteWithWarningForEmptyDocument() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(PageSource.EMPTY);
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("blank.docx"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(1.0, job.progress());
        assertTrue(job.segments().isEmpty());
        assertEquals(List.of(JobOrchestrator.NO_CONTENT_WARNING), job.warnings());
    }
    
    @Test
    void shouldCompleteTextOnlyDocumentWithoutRecognition() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        AtomicBoolean engineCalled = new AtomicBoolean();
        decodeBehaviour = doc -> new ResolvedDocument(PageSource.EMPTY, "Body text",
            List.of("No embedded images found in the document; OCR is limited to textual extraction."));
        pageScript = (pageIndex, sink) -> {
            engineCalled.set(true);
            return new RecognitionResult("", 0);
        };
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("memo.docx"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals("Body text", job.extractedText());
        assertEquals(1, job.warnings().size());
        assertFalse(engineCalled.get());
        assertEquals("Body text\n\n", new AggregatedTextComposer().compose(job));
    }
    
    @Test
    void shouldFailJobWhenArtifactCannotBeFetchedWithoutAffectingOthers() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        unavailableLanguages.add("deu");
        
        String failing = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng", "deu"));
        String passing = orchestrator.submit(document("b.png"), ContentClass.RASTER_IMAGE, List.of("fra"));
        
        JobSnapshot failed = orchestrator.getSnapshot(failing);
        assertEquals(JobStatus.ERROR, failed.status());
        assertEquals(ErrorKind.ARTIFACT_FETCH_FAILED, failed.error().kind());
        assertTrue(failed.error().message().contains("deu"));
        assertTrue(failed.segments().isEmpty());
        
        assertEquals(JobStatus.COMPLETED, orchestrator.getSnapshot(passing).status());
    }
    
    @Test
    void shouldFailWithUnsupportedFormatWhenDecoderRejectsDocument() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        decodeBehaviour = doc -> {
            throw new UnsupportedFormatException("Could not read image " + doc.name());
        };
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("broken.png"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.ERROR, job.status());
        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, job.error().kind());
        assertEquals("Could not read image broken.png", job.error().message());
    }
    
    @Test
    void shouldFailWithUnsupportedFormatWhenNoDecoderIsRegistered() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("report.pdf"), ContentClass.PAGINATED_DOCUMENT, List.of("eng")));
        
        assertEquals(JobStatus.ERROR, job.status());
        assertEquals(ErrorKind.UNSUPPORTED_FORMAT, job.error().kind());
    }
    
    @Test
    void shouldWarnAboutSlowPages() {
        processingProperties.setSlowPageThreshold(Duration.ofMillis(10));
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        pageScript = (pageIndex, sink) -> {
            Thread.sleep(50);
            return new RecognitionResult("slow", 70.0);
        };
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(JobStatus.COMPLETED, job.status());
        assertEquals(1, job.warnings().size());
        assertTrue(job.warnings().get(0).startsWith("Page 1 took "));
        assertTrue(job.warnings().get(0).endsWith("s to process. Consider splitting large documents."));
    }
    
    @Test
    void shouldClampEngineConfidence() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        pageScript = (pageIndex, sink) -> new RecognitionResult("x", 140.0);
        
        JobSnapshot job = orchestrator.getSnapshot(
            orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng")));
        
        assertEquals(100.0, job.segments().get(0).confidence());
    }
    
    @Test
    void shouldRunJobAtMostOnce() {
        List<Runnable> queued = new ArrayList<>();
        JobOrchestrator orchestrator = orchestrator(queued::add, DIRECT);
        AtomicInteger recognitions = new AtomicInteger();
        pageScript = (pageIndex, sink) -> {
            recognitions.incrementAndGet();
            return new RecognitionResult("once", 90.0);
        };
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        assertEquals(JobStatus.PENDING, orchestrator.getSnapshot(jobId).status());
        assertEquals(0, orchestrator.dispatchPending());
        
        queued.forEach(Runnable::run);
        orchestrator.run(jobId);
        orchestrator.run("job_unknown");
        
        assertEquals(JobStatus.COMPLETED, orchestrator.getSnapshot(jobId).status());
        assertEquals(1, recognitions.get());
    }
    
    @Test
    void shouldKeepRejectedJobPendingUntilAdmissionLoopDispatchesIt() {
        AtomicBoolean saturated = new AtomicBoolean(true);
        List<Runnable> queued = new ArrayList<>();
        Executor boundedPool = task -> {
            if (saturated.get()) {
                throw new RejectedExecutionException("job queue is full");
            }
            queued.add(task);
        };
        JobOrchestrator orchestrator = orchestrator(boundedPool, DIRECT);
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        
        assertEquals(JobStatus.PENDING, orchestrator.getSnapshot(jobId).status());
        assertEquals(0, orchestrator.dispatchPending());
        assertTrue(queued.isEmpty());
        
        saturated.set(false);
        assertEquals(1, orchestrator.dispatchPending());
        assertEquals(0, orchestrator.dispatchPending());
        assertEquals(1, queued.size());
        
        queued.forEach(Runnable::run);
        assertEquals(JobStatus.COMPLETED, orchestrator.getSnapshot(jobId).status());
    }
    
    @Test
    void shouldFailJobWhenStatusListenerThrowsOnClaim() {
        statusListener = event -> {
            if (event instanceof JobStatusChanged changed && changed.job().status() == JobStatus.PROCESSING) {
                throw new IllegalStateException("listener unavailable");
            }
        };
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        
        JobSnapshot job = orchestrator.getSnapshot(jobId);
        assertEquals(JobStatus.ERROR, job.status());
        assertEquals(ErrorKind.INTERNAL, job.error().kind());
        assertTrue(job.error().message().contains("listener unavailable"));
    }
    
    @Test
    void shouldCancelPendingJob() {
        List<Runnable> queued = new ArrayList<>();
        JobOrchestrator orchestrator = orchestrator(queued::add, DIRECT);
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        assertTrue(orchestrator.cancel(jobId));
        queued.forEach(Runnable::run);
        
        JobSnapshot job = orchestrator.getSnapshot(jobId);
        assertEquals(JobStatus.ERROR, job.status());
        assertEquals(ErrorKind.CANCELLED, job.error().kind());
        assertEquals(0, fetchCount.get());
        assertFalse(orchestrator.cancel(jobId));
    }
    
    @Test
    void shouldStopWaitingForArtifactsWhenCancelled() {
        List<Runnable> parkedFetches = new CopyOnWriteArrayList<>();
        ExecutorService jobPool = pool(1);
        JobOrchestrator orchestrator = orchestrator(jobPool, parkedFetches::add);
        
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> orchestrator.getSnapshot(jobId).status() == JobStatus.PROCESSING && !parkedFetches.isEmpty());
        
        assertTrue(orchestrator.cancel(jobId));
        
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> orchestrator.getSnapshot(jobId).status() == JobStatus.ERROR);
        assertEquals(ErrorKind.CANCELLED, orchestrator.getSnapshot(jobId).error().kind());
        
        // the shared fetch is still there for whoever needs it next
        parkedFetches.forEach(Runnable::run);
        assertEquals(1, fetchCount.get());
    }
    
    @Test
    void shouldStopBeforeNextPageWhenCancelledMidway() throws Exception {
        ExecutorService jobPool = pool(1);
        JobOrchestrator orchestrator = orchestrator(jobPool, DIRECT);
        CountDownLatch firstPageStarted = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(3));
        pageScript = (pageIndex, sink) -> {
            firstPageStarted.countDown();
            cancelled.await(5, TimeUnit.SECONDS);
            return new RecognitionResult("page", 90.0);
        };
        
        String jobId = orchestrator.submit(document("a.pdf"), ContentClass.RASTER_IMAGE, List.of("eng"));
        assertTrue(firstPageStarted.await(5, TimeUnit.SECONDS));
        orchestrator.cancel(jobId);
        cancelled.countDown();
        
        await().atMost(5, TimeUnit.SECONDS)
                .until(() -> orchestrator.getSnapshot(jobId).status() == JobStatus.ERROR);
        JobSnapshot job = orchestrator.getSnapshot(jobId);
        assertEquals(ErrorKind.CANCELLED, job.error().kind());
        assertEquals(List.of(0), job.segments().stream().map(Segment::pageIndex).toList());
    }
    
    @Test
    void shouldRunJobsConcurrentlyAndFetchSharedLanguageOnce() {
        ExecutorService jobPool = pool(4);
        ExecutorService fetchPool = pool(2);
        JobOrchestrator orchestrator = orchestrator(jobPool, fetchPool);
        decodeBehaviour = doc -> ResolvedDocument.ofPages(pages(2));
        pageScript = (pageIndex, sink) -> new RecognitionResult("p" + pageIndex, 75.0);
        
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            jobIds.add(orchestrator.submit(document("doc" + i + ".png"), ContentClass.RASTER_IMAGE, List.of("eng")));
        }
        
        await().atMost(10, TimeUnit.SECONDS).until(() -> jobIds.stream()
                .allMatch(id -> orchestrator.getSnapshot(id).status() == JobStatus.COMPLETED));
        for (String jobId : jobIds) {
            assertEquals(List.of(0, 1), orchestrator.getSnapshot(jobId).segments().stream()
                .map(Segment::pageIndex).collect(Collectors.toList()));
        }
        assertEquals(1, fetchCount.get());
    }
    
    @Test
    void shouldDiscardJob() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        String jobId = orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        
        orchestrator.discard(jobId);
        
        assertThrows(NotFoundException.class, () -> orchestrator.getSnapshot(jobId));
        assertThrows(NotFoundException.class, () -> orchestrator.discard(jobId));
        assertTrue(orchestrator.listSnapshots().isEmpty());
    }
    
    @Test
    void shouldClosePagesAfterRecognition() {
        JobOrchestrator orchestrator = orchestrator(DIRECT, DIRECT);
        AtomicBoolean closed = new AtomicBoolean();
        decodeBehaviour = doc -> ResolvedDocument.ofPages(new PageSource() {
            @Override
            public int pageCount() {
                return 1;
            }
            
            @Override
            public BufferedImage render(int pageIndex) {
                return image(pageIndex);
            }
            
            @Override
            public void close() {
                closed.set(true);
            }
        });
        
        orchestrator.submit(document("a.png"), ContentClass.RASTER_IMAGE, List.of("eng"));
        
        assertTrue(closed.get());
    }
    
    private JobOrchestrator orchestrator(Executor jobExecutor, Executor fetchExecutor) {
        LanguageArtifactRegistry registry = new LanguageArtifactRegistry(artifactProperties);
        ArtifactCache cache = new ArtifactCache(
            registry,
            new FileSystemArtifactStore(artifactProperties),
            code -> {
                fetchCount.incrementAndGet();
                if (unavailableLanguages.contains(code)) {
                    throw new IOException("404 Not Found");
                }
                return ("model-" + code).getBytes(StandardCharsets.UTF_8);
            },
            fetchExecutor
        );
        
        DocumentDecoder scripted = new DocumentDecoder() {
            @Override
            public ContentClass contentClass() {
                return ContentClass.RASTER_IMAGE;
            }
            
            @Override
            public ResolvedDocument decode(IntakeDocument document) {
                return decodeBehaviour.apply(document);
            }
        };
        
        RecognitionGateway gateway = new RecognitionGateway(
            (page, languages, sink) -> pageScript.recognize(page.getWidth() - 1, sink));
        
        return new JobOrchestrator(
            cache,
            registry,
            new FormatResolver(List.of(scripted)),
            gateway,
            new ProgressAggregator(events::add),
            processingProperties,
            event -> {
                events.add(event);
                statusListener.accept(event);
            },
            jobExecutor
        );
    }
    
    private ExecutorService pool(int threads) {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        pools.add(pool);
        return pool;
    }
    
    private static IntakeDocument document(String name) {
        return new IntakeDocument(name, "image/png", new byte[]{1, 2, 3});
    }
    
    /**
     * Pages whose rendered width encodes the page index, so the fake engine knows which
     * page it was given.
     */
    private static PageSource pages(int count) {
        return new PageSource() {
            @Override
            public int pageCount() {
                return count;
            }
            
            @Override
            public BufferedImage render(int pageIndex) {
                return image(pageIndex);
            }
            
            @Override
            public void close() {
            }
        };
    }
    
    private static BufferedImage image(int pageIndex) {
        return new BufferedImage(pageIndex + 1, 1, BufferedImage.TYPE_INT_RGB);
    }
    
    @FunctionalInterface
    private interface PageScript {
        RecognitionResult recognize(int pageIndex, ProgressSink sink) throws Exception;
    }
}
