package io.regtruth.pipeline.fetch;

import io.regtruth.pipeline.api.exception.ErrorCategory;
import io.regtruth.pipeline.config.PipelineConfig;
import io.regtruth.pipeline.domain.ContentClass;
import io.regtruth.pipeline.domain.DiscoveredItem;
import io.regtruth.pipeline.domain.DiscoveredItemStatus;
import io.regtruth.pipeline.domain.Evidence;
import io.regtruth.pipeline.domain.FreshnessRisk;
import io.regtruth.pipeline.domain.NodeType;
import io.regtruth.pipeline.fetch.parser.BinaryDocumentParser;
import io.regtruth.pipeline.fetch.parser.ParsedDocument;
import io.regtruth.pipeline.fetch.parser.TextExtractor;
import io.regtruth.pipeline.fetch.parser.WordDocumentParser;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import io.regtruth.pipeline.http.FetchResponse;
import io.regtruth.pipeline.ratelimit.FetchOutcome;
import io.regtruth.pipeline.ratelimit.RateLimitedFetcher;
import io.regtruth.pipeline.scheduler.AdaptiveScheduler;
import io.regtruth.pipeline.store.memory.InMemoryDiscoveredItemStore;
import io.regtruth.pipeline.store.memory.InMemoryEvidenceStore;
import io.regtruth.pipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T07:00:00Z");
    private static final String URL = "https://hzzo.hr/novosti/obavijest-1";
    private static final String PDF_URL = "https://hzzo.hr/obrasci/tiskanica.pdf";

    @Mock
    private RateLimitedFetcher fetcher;

    @Mock
    private EvidenceQueue evidenceQueue;

    private MutableClock clock;
    private InMemoryDiscoveredItemStore itemStore;
    private InMemoryEvidenceStore evidenceStore;
    private StubPdfParser pdfParser;
    private FetchService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        itemStore = new InMemoryDiscoveredItemStore();
        evidenceStore = new InMemoryEvidenceStore();
        pdfParser = new StubPdfParser();
        AdaptiveScheduler scheduler = new AdaptiveScheduler(itemStore,
                new PipelineConfig(List.of(), null, null, null, null), clock);
        service = new FetchService(fetcher, scheduler, evidenceStore, evidenceQueue, new ContentClassifier(),
                new TextExtractor(), List.of(pdfParser, new WordDocumentParser()), Runnable::run, clock);
    }

    @Test
    @DisplayName("Should snapshot a new page, hand it to extraction and mark the item processed")
    void shouldSnapshotNewPage() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(html("<p>Nova lista lijekova</p>"));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.processed()).isEqualTo(1);
        assertThat(result.fetched()).isEqualTo(1);

        DiscoveredItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.PROCESSED);
        assertThat(item.contentHash()).isNotNull();
        assertThat(item.scanCount()).isEqualTo(1);

        ArgumentCaptor<Evidence> captor = ArgumentCaptor.forClass(Evidence.class);
        verify(evidenceQueue).queueForExtraction(captor.capture());
        Evidence evidence = captor.getValue();
        assertThat(evidence.url()).isEqualTo(URL);
        assertThat(evidence.contentClass()).isEqualTo(ContentClass.HTML);
        assertThat(evidence.contentChanged()).isFalse();
        assertThat(evidence.changeSummary()).isEqualTo("initial snapshot");
        assertThat(evidence.derivedText()).isEqualTo("Nova lista lijekova");
        assertThat(evidence.discoveredItemId()).isEqualTo("item-1");
    }

    @Test
    @DisplayName("Should create no evidence when a rescan finds identical content")
    void shouldSkipUnchangedRescan() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(html("<p>Nova lista lijekova</p>"));
        service.processPendingItems(10);
        clock.advance(Duration.ofDays(5));

        FetchRunResult result = service.rescanDueItems(10);

        assertThat(result.unchanged()).isEqualTo(1);
        verify(evidenceQueue, times(1)).queueForExtraction(any());
        DiscoveredItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.PROCESSED);
        assertThat(item.scanCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should snapshot changed content as new evidence with a change summary")
    void shouldSnapshotChangedContent() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(html("<p>Prvi redak</p>"), html("<p>Prvi redak</p>\n<p>Drugi redak</p>"));
        service.processPendingItems(10);
        clock.advance(Duration.ofDays(5));

        FetchRunResult result = service.rescanDueItems(10);

        assertThat(result.changed()).isEqualTo(1);
        ArgumentCaptor<Evidence> captor = ArgumentCaptor.forClass(Evidence.class);
        verify(evidenceQueue, times(2)).queueForExtraction(captor.capture());
        Evidence latest = captor.getAllValues().get(1);
        assertThat(latest.contentChanged()).isTrue();
        assertThat(latest.changeSummary()).isEqualTo("+1 -0 lines");
    }

    @Test
    @DisplayName("Should route scanned PDFs to OCR")
    void shouldRouteScannedPdfToOcr() {
        itemStore.insertIfAbsent(pending("pdf-1", PDF_URL));
        pdfParser.scanned = true;
        when(fetcher.fetch(PDF_URL)).thenReturn(success(PDF_URL, "application/pdf", "%PDF-1.4 image"));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.fetched()).isEqualTo(1);
        ArgumentCaptor<Evidence> captor = ArgumentCaptor.forClass(Evidence.class);
        verify(evidenceQueue).queueForOcr(captor.capture());
        verify(evidenceQueue, never()).queueForExtraction(any());
        assertThat(captor.getValue().contentClass()).isEqualTo(ContentClass.PDF_SCANNED);
        assertThat(captor.getValue().derivedText()).isNull();
    }

    @Test
    @DisplayName("Should record a retryable fetch failure and schedule a retry")
    void shouldRecordRetryableFailure() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(new FetchOutcome.Failure(URL, ErrorCategory.SERVER_UNAVAILABLE, true, 4,
                "HTTP 503", 503));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.failed()).isEqualTo(1);
        DiscoveredItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.FAILED);
        assertThat(item.retryCount()).isEqualTo(1);
        assertThat(item.lastError()).isEqualTo("HTTP 503");
        assertThat(item.nextScanDue()).isEqualTo(NOW.plus(Duration.ofMinutes(30)));
        verifyNoInteractions(evidenceQueue);
    }

    @Test
    @DisplayName("Should leave items untouched while the domain circuit is open")
    void shouldDeferWhenCircuitOpen() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(new FetchOutcome.CircuitOpen("hzzo.hr", "Circuit open for hzzo.hr"));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.deferred()).isEqualTo(1);
        assertThat(itemStore.findById("item-1").orElseThrow().status()).isEqualTo(DiscoveredItemStatus.PENDING);
    }

    @Test
    @DisplayName("Should skip content that cannot be processed")
    void shouldSkipUnsupportedContent() {
        itemStore.insertIfAbsent(pending("bin-1", "https://hzzo.hr/download/arhiva.bin"));
        when(fetcher.fetch("https://hzzo.hr/download/arhiva.bin"))
                .thenReturn(success("https://hzzo.hr/download/arhiva.bin", "application/octet-stream", "\u0001\u0002"));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.skipped()).isEqualTo(1);
        DiscoveredItem item = itemStore.findById("bin-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.SKIPPED);
        assertThat(item.lastError()).isEqualTo("Unsupported content type: application/octet-stream");
    }

    @Test
    @DisplayName("Should parse Word documents to text and hand them to extraction")
    void shouldParseWordDocuments() throws Exception {
        String docxUrl = "https://hzzo.hr/obrasci/zahtjev.docx";
        byte[] docx = docx("Zahtjev za dopunsko zdravstveno osiguranje");
        itemStore.insertIfAbsent(pending("docx-1", docxUrl));
        when(fetcher.fetch(docxUrl)).thenReturn(new FetchOutcome.Success(
                new FetchResponse(docxUrl, 200, "application/octet-stream", docx), 1));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.fetched()).isEqualTo(1);
        assertThat(result.skipped()).isZero();
        assertThat(itemStore.findById("docx-1").orElseThrow().status()).isEqualTo(DiscoveredItemStatus.PROCESSED);

        ArgumentCaptor<Evidence> captor = ArgumentCaptor.forClass(Evidence.class);
        verify(evidenceQueue).queueForExtraction(captor.capture());
        assertThat(captor.getValue().contentClass()).isEqualTo(ContentClass.DOCX);
        assertThat(captor.getValue().derivedText()).contains("dopunsko zdravstveno osiguranje");
        assertThat(captor.getValue().contentHash()).isEqualTo(ContentHasher.hashBytes(docx));
    }

    @Test
    @DisplayName("Should fail without retry when a Word document is corrupt")
    void shouldFailOnCorruptWordDocument() {
        String docxUrl = "https://hzzo.hr/obrasci/zahtjev.docx";
        itemStore.insertIfAbsent(pending("docx-1", docxUrl));
        when(fetcher.fetch(docxUrl)).thenReturn(success(docxUrl, "application/octet-stream", "PK.."));

        FetchRunResult result = service.processPendingItems(10);

        assertThat(result.failed()).isEqualTo(1);
        DiscoveredItem item = itemStore.findById("docx-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.FAILED);
        assertThat(item.lastError()).startsWith("DOCX extraction failed");
        verifyNoInteractions(evidenceQueue);
    }

    @Test
    @DisplayName("Should fail without retry when no text can be extracted")
    void shouldFailOnEmptyText() {
        itemStore.insertIfAbsent(pending("item-1", URL));
        when(fetcher.fetch(URL)).thenReturn(html("<script>only()</script>"));

        service.processPendingItems(10);

        DiscoveredItem item = itemStore.findById("item-1").orElseThrow();
        assertThat(item.status()).isEqualTo(DiscoveredItemStatus.FAILED);
        assertThat(item.retryCount()).isEqualTo(3);
        assertThat(item.nextScanDue()).isNull();
        assertThat(item.lastError()).isEqualTo("Empty text extraction");
    }

    private static DiscoveredItem pending(String id, String url) {
        return new DiscoveredItem(id, "hzzo", url, "hzzo.hr", DiscoveredItemStatus.PENDING, null, 0.5, 0,
                FreshnessRisk.MEDIUM, NodeType.LEAF, null, NOW, null, 0, null, NOW);
    }

    private static FetchOutcome html(String body) {
        return success(URL, "text/html; charset=UTF-8", "<html><body>" + body + "</body></html>");
    }

    private static FetchOutcome success(String url, String contentType, String body) {
        return new FetchOutcome.Success(new FetchResponse(url, 200, contentType, body.getBytes(StandardCharsets.UTF_8)), 1);
    }

    private static class StubPdfParser implements BinaryDocumentParser {
        private boolean scanned;

        @Override
        public boolean supports(ContentClass contentClass) {
            return contentClass == ContentClass.PDF_TEXT;
        }

        @Override
        public ParsedDocument parse(byte[] content, ContentClass contentClass) {
            return new ParsedDocument(scanned ? "" : "Tekst obrasca", 1, scanned);
        }
    }

    private static byte[] docx(String text) throws IOException {
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText(text);
            document.write(out);
            return out.toByteArray();
        }
    }
}
