package org.circomscan.analysis.impl;

import org.circomscan.analysis.AnalysisException;
import org.circomscan.analysis.AnalysisPass;
import org.circomscan.analysis.AnalysisRunner;
import org.circomscan.analysis.Checkout;
import org.circomscan.analysis.writer.ReportWriter;
import org.circomscan.structure.cfg.Cfg;
import org.circomscan.structure.cfg.CfgLowering;
import org.circomscan.structure.cfg.SsaLowering;
import org.circomscan.structure.constants.Curve;
import org.circomscan.structure.definition.DefinitionKind;
import org.circomscan.structure.definition.DefinitionStore;
import org.circomscan.structure.file.FileLibrary;
import org.circomscan.structure.file.FileLocation;
import org.circomscan.structure.report.ReportCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class AnalysisRunnerImpl implements AnalysisRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalysisRunnerImpl.class);

    private final DefinitionStore definitionStore;
    private final Configuration configuration;
    private final CfgCache templateCache;
    private final CfgCache functionCache;

    public AnalysisRunnerImpl(DefinitionStore definitionStore) {
        this(definitionStore, new ConfigurationBuilder().build());
    }

    public AnalysisRunnerImpl(DefinitionStore definitionStore, Configuration configuration) {
        this.definitionStore = Objects.requireNonNull(definitionStore);
        this.configuration = Objects.requireNonNull(configuration);
        this.templateCache = new CfgCache(DefinitionKind.TEMPLATE, definitionStore::templateOrNull,
                configuration.lowering(), configuration.curve());
        this.functionCache = new CfgCache(DefinitionKind.FUNCTION, definitionStore::functionOrNull,
                configuration.lowering(), configuration.curve());
    }

    public record ConfigurationImpl(Curve curve,
                                    List<AnalysisPass> analysisPasses,
                                    CfgLowering lowering) implements Configuration {
    }

    public static class ConfigurationBuilder {
        private Curve curve = Curve.defaultCurve();
        private final List<AnalysisPass> analysisPasses = new ArrayList<>();
        private CfgLowering lowering = SsaLowering.INSTANCE;

        public ConfigurationBuilder setCurve(Curve curve) {
            this.curve = curve;
            return this;
        }

        public ConfigurationBuilder addAnalysisPass(AnalysisPass analysisPass) {
            this.analysisPasses.add(analysisPass);
            return this;
        }

        public ConfigurationBuilder addAnalysisPasses(List<AnalysisPass> analysisPasses) {
            this.analysisPasses.addAll(analysisPasses);
            return this;
        }

        public ConfigurationBuilder setLowering(CfgLowering lowering) {
            this.lowering = lowering;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(curve, List.copyOf(analysisPasses), lowering);
        }
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public FileLibrary fileLibrary() {
        return definitionStore.fileLibrary();
    }

    CfgCache cache(DefinitionKind kind) {
        return kind == DefinitionKind.TEMPLATE ? templateCache : functionCache;
    }

    // ---- context

    @Override
    public boolean isTemplate(String name) {
        return definitionStore.isTemplate(name);
    }

    @Override
    public boolean isFunction(String name) {
        return definitionStore.isFunction(name);
    }

    @Override
    public Cfg template(String name) {
        return templateCache.ensure(name);
    }

    @Override
    public Cfg function(String name) {
        return functionCache.ensure(name);
    }

    @Override
    public String underlyingStr(int fileId, FileLocation location) {
        FileLibrary.SourceFile file = definitionStore.fileLibrary().fileOrNull(fileId);
        if (file == null) {
            throw AnalysisException.unknownFile(fileId);
        }
        byte[] bytes = file.bytes();
        if (location.start() > location.end() || location.end() > bytes.length
            || isContinuationByte(bytes, location.start()) || isContinuationByte(bytes, location.end())) {
            throw AnalysisException.invalidLocation(fileId, location);
        }
        return new String(bytes, location.start(), location.length(), StandardCharsets.UTF_8);
    }

    // an offset inside a multi-byte UTF-8 sequence is not a character boundary
    private static boolean isContinuationByte(byte[] bytes, int offset) {
        return offset < bytes.length && (bytes[offset] & 0xC0) == 0x80;
    }

    // ---- names

    @Override
    public List<String> templateNames(boolean userInputOnly) {
        return definitionStore.templateNames(userInputOnly);
    }

    @Override
    public List<String> functionNames(boolean userInputOnly) {
        return definitionStore.functionNames(userInputOnly);
    }

    // ---- take / replace

    @Override
    public Checkout takeTemplate(String name) {
        return templateCache.take(name);
    }

    @Override
    public Checkout takeFunction(String name) {
        return functionCache.take(name);
    }

    @Override
    public boolean replaceTemplate(String name, Cfg cfg) {
        return templateCache.replace(name, cfg);
    }

    @Override
    public boolean replaceFunction(String name, Cfg cfg) {
        return functionCache.replace(name, cfg);
    }

    // ---- analysis

    @Override
    public void analyzeTemplates(ReportWriter writer, boolean userInputOnly) {
        List<String> names = templateNames(userInputOnly);
        for (String name : names) {
            analyze(templateCache, name, writer);
        }
        LOGGER.info("Analyzed {} templates", names.size());
    }

    @Override
    public void analyzeFunctions(ReportWriter writer, boolean userInputOnly) {
        List<String> names = functionNames(userInputOnly);
        for (String name : names) {
            analyze(functionCache, name, writer);
        }
        LOGGER.info("Analyzed {} functions", names.size());
    }

    @Override
    public void analyzeTemplate(String name, ReportWriter writer) {
        analyze(templateCache, name, writer);
    }

    @Override
    public void analyzeFunction(String name, ReportWriter writer) {
        analyze(functionCache, name, writer);
    }

    /*
    Lowering reports come first, then the reports of each pass in configuration order.
    The CFG is checked out while the passes run, so that a pass may look up the definition under analysis
    (which then gets lowered again) without seeing the CFG being analyzed.
     */
    private void analyze(CfgCache cache, String name, ReportWriter writer) {
        String keyword = cache.kind().keyword();
        writer.writeMessage("analyzing " + keyword + " '" + name + "'");
        ReportCollection reports = new ReportCollection();
        Checkout checkout;
        try {
            checkout = cache.take(name);
        } catch (AnalysisException ae) {
            LOGGER.debug("Cannot analyze {} {}: {}", keyword, name, ae.getMessage());
            reports.append(cache.takeReports(name));
            writer.writeReports(reports, fileLibrary());
            return;
        }
        reports.append(checkout.reports());
        Cfg cfg = checkout.cfg();
        try {
            for (AnalysisPass pass : configuration.analysisPasses()) {
                try {
                    reports.append(pass.run(this, cfg));
                } catch (AnalysisException ae) {
                    LOGGER.warn("Analysis pass on {} {} failed: {}", keyword, name, ae.getMessage());
                }
            }
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception analyzing {} {}", keyword, name);
            throw re;
        } finally {
            if (cache.replace(name, cfg)) {
                LOGGER.debug("{} `{}` CFG was regenerated during analysis", keyword, name);
            }
        }
        writer.writeReports(reports, fileLibrary());
    }
}
