package com.example.modelaudit.graph;

import com.example.modelaudit.formula.FormulaParseException;
import com.example.modelaudit.formula.FormulaToken;
import com.example.modelaudit.formula.FormulaTokenizer;
import com.example.modelaudit.formula.ReferenceResolver;
import com.example.modelaudit.model.CellRole;
import com.example.modelaudit.model.CellTable;
import com.example.modelaudit.model.CellValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DependencyGraphBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final FormulaTokenizer tokenizer;
    private final ReferenceResolver resolver;
    private final int threads;

    private int nodeCount;
    private int parseErrorCount;

    public DependencyGraphBuilder() {
        this(1);
    }

    public DependencyGraphBuilder(int threads) {
        this(new FormulaTokenizer(), new ReferenceResolver(), threads);
    }

    public DependencyGraphBuilder(FormulaTokenizer tokenizer, ReferenceResolver resolver, int threads) {
        this.tokenizer = tokenizer;
        this.resolver = resolver;
        this.threads = Math.max(1, threads);
    }

    public DependencyGraph build(Map<String, CellTable> formulaTables) {
        if (formulaTables == null) {
            throw new IllegalArgumentException("Formula tables are required");
        }
        for (Map.Entry<String, CellTable> entry : formulaTables.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("Missing formula table for sheet '" + entry.getKey() + "'");
            }
        }

        LOGGER.info("Building dependency graph over {} sheet(s)", formulaTables.size());
        nodeCount = 0;
        parseErrorCount = 0;

        List<SheetScan> scans = threads > 1 && formulaTables.size() > 1
                ? scanConcurrently(formulaTables)
                : scanSequentially(formulaTables);

        DependencyGraph graph = new DependencyGraph();
        for (SheetScan scan : scans) {
            for (FormulaCell cell : scan.cells()) {
                graph.addNode(cell.nodeId(), cell.role());
                for (String source : cell.sources()) {
                    graph.addEdge(source, cell.nodeId());
                }
                nodeCount++;
                if (cell.role() == CellRole.PARSE_ERROR) {
                    parseErrorCount++;
                }
            }
        }

        LOGGER.info("Graph built. Calculation nodes: {}, graph nodes: {}, dependencies mapped: {}",
                nodeCount, graph.nodeCount(), graph.edgeCount());
        if (parseErrorCount > 0) {
            LOGGER.warn("{} formula(s) could not be parsed and were tagged as parse errors", parseErrorCount);
        }
        return graph;
    }

    /**
     * Formula cells processed by the last build, not the graph's node count.
     */
    public int getNodeCount() {
        return nodeCount;
    }

    public int getParseErrorCount() {
        return parseErrorCount;
    }

    private List<SheetScan> scanSequentially(Map<String, CellTable> formulaTables) {
        List<SheetScan> scans = new ArrayList<>(formulaTables.size());
        formulaTables.forEach((sheetName, table) -> scans.add(scanSheet(sheetName, table)));
        return scans;
    }

    private List<SheetScan> scanConcurrently(Map<String, CellTable> formulaTables) {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, formulaTables.size()));
        try {
            List<Future<SheetScan>> futures = new ArrayList<>(formulaTables.size());
            formulaTables.forEach((sheetName, table) -> {
                Callable<SheetScan> task = () -> scanSheet(sheetName, table);
                futures.add(executor.submit(task));
            });

            List<SheetScan> scans = new ArrayList<>(futures.size());
            for (Future<SheetScan> future : futures) {
                scans.add(future.get());
            }
            return scans;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while building dependency graph", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Failed to scan sheet formulas", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private SheetScan scanSheet(String sheetName, CellTable table) {
        List<FormulaCell> cells = new ArrayList<>();
        for (int row = 0; row < table.getRowCount(); row++) {
            for (int col = 0; col < table.getColumnCount(); col++) {
                CellValue value = table.get(row, col);
                if (CellRole.of(value) != CellRole.FORMULA) {
                    continue;
                }
                String target = resolver.nodeId(sheetName, row, col);
                cells.add(scanFormula(target, value.getText(), sheetName));
            }
        }
        LOGGER.debug("Sheet '{}': {} formula cell(s)", sheetName, cells.size());
        return new SheetScan(sheetName, cells);
    }

    private FormulaCell scanFormula(String target, String formula, String sheetName) {
        try {
            List<String> sources = new ArrayList<>();
            for (FormulaToken token : tokenizer.tokenize(formula)) {
                if (token.isCellReference()) {
                    sources.add(resolver.resolve(token.value(), sheetName));
                }
            }
            return new FormulaCell(target, CellRole.FORMULA, sources);
        } catch (FormulaParseException e) {
            LOGGER.debug("Tagging {} as parse error at position {} of {}", target, e.getPosition(), e.getFormula());
            return new FormulaCell(target, CellRole.PARSE_ERROR, List.of());
        }
    }

    private record SheetScan(String sheetName, List<FormulaCell> cells) {
    }

    private record FormulaCell(String nodeId, CellRole role, List<String> sources) {
    }
}
