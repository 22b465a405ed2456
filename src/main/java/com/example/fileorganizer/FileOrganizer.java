package com.example.fileorganizer;

import com.example.fileorganizer.backend.ChatBackend;
import com.example.fileorganizer.backend.ChatBackends;
import com.example.fileorganizer.classify.ClassificationRules;
import com.example.fileorganizer.classify.Classifier;
import com.example.fileorganizer.extract.ContentExtractor;
import com.example.fileorganizer.extract.FileRecordReader;
import com.example.fileorganizer.extract.TikaContentExtractor;
import com.example.fileorganizer.json.ObjectMappers;
import com.example.fileorganizer.migrate.DuplicateCleaner;
import com.example.fileorganizer.migrate.DuplicateReport;
import com.example.fileorganizer.model.ClassificationDecision;
import com.example.fileorganizer.model.FileRecord;
import com.example.fileorganizer.store.ResultStatistics;
import com.example.fileorganizer.store.ResultStore;
import com.example.fileorganizer.transferlog.RestoreReport;
import com.example.fileorganizer.transferlog.SessionInfo;
import com.example.fileorganizer.transferlog.SessionSummary;
import com.example.fileorganizer.transferlog.TransferLog;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Entry points of the organizer, wired from one {@link OrganizerConfig}.
 */
public class FileOrganizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileOrganizer.class);

    private final OrganizerConfig config;
    private final FileScanner scanner;
    private final Classifier classifier;
    private final TransferLog transferLog;
    private final ResultStore resultStore;
    private final OrganizeEngine engine;

    public FileOrganizer(OrganizerConfig config) {
        this(config, ObjectMappers.create(), new TikaContentExtractor(new Tika()));
    }

    private FileOrganizer(OrganizerConfig config, ObjectMapper mapper, ContentExtractor extractor) {
        this(config, mapper, ChatBackends.fromEndpoints(config.backends(), config.backendRetryAttempts(),
                config.backendRetryBackoff(), config.backendRequestTimeout(), mapper), extractor);
    }

    FileOrganizer(OrganizerConfig config, ObjectMapper mapper, Optional<ChatBackend> chat, ContentExtractor extractor) {
        this.config = config;
        if (chat.isEmpty()) {
            LOGGER.info("No chat backend enabled; classifying by file name only");
        }
        ClassificationRules rules = config.classificationRulesFile()
                .map(file -> ClassificationRules.load(file, mapper))
                .orElse(ClassificationRules.none());
        this.scanner = FileScanner.fromConfig(config);
        this.classifier = Classifier.create(chat, extractor, rules,
                config.contentExtractionLength(), config.summaryLength(), config.maxDepth());
        this.transferLog = new TransferLog(config.transferLogDirectory(), mapper);
        this.resultStore = new ResultStore(config.resultStoreFile(), mapper);
        ProcessingLimiter limiter = config.maxFiles()
                .map(max -> ProcessingLimiter.maxFiles(max))
                .orElse(ProcessingLimiter.NO_LIMIT);
        this.engine = new OrganizeEngine(classifier, transferLog, resultStore, config.operation(),
                config.threadCount(), config.fileTimeout(), limiter);
    }

    public List<FileRecord> scan() throws IOException {
        return scan(config.sourceDirectories());
    }

    public List<FileRecord> scan(List<Path> directories) throws IOException {
        return scanner.scan(directories);
    }

    public ClassificationDecision classify(Path file, Path targetRoot) throws IOException {
        return classifier.classify(new FileRecordReader().read(file), targetRoot);
    }

    public OrganizeReport organize(List<FileRecord> files, Path targetRoot, boolean dryRun)
            throws IOException, InterruptedException {
        return engine.organize(files, targetRoot, dryRun);
    }

    public void requestStop() {
        engine.requestStop();
    }

    public RestoreReport restore(String session, Collection<Long> operationIds, boolean dryRun) throws IOException {
        return transferLog.restore(session, operationIds, dryRun);
    }

    public DuplicateReport removeDuplicates(Path folder, boolean dryRun) throws IOException {
        return new DuplicateCleaner(transferLog).removeDuplicates(folder, dryRun);
    }

    public List<SessionInfo> sessions() throws IOException {
        return transferLog.listSessions();
    }

    public SessionSummary summarize(String session) throws IOException {
        return transferLog.summarize(session);
    }

    public ResultStatistics resultStatistics() throws IOException {
        return resultStore.statistics();
    }

    TransferLog transferLog() {
        return transferLog;
    }

    ResultStore resultStore() {
        return resultStore;
    }
}
