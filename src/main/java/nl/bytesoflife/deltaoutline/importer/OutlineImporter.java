package nl.bytesoflife.deltaoutline.importer;

import nl.bytesoflife.deltaoutline.geometry.NestedSubpath;
import nl.bytesoflife.deltaoutline.geometry.NestingResolver;
import nl.bytesoflife.deltaoutline.geometry.OutlineNormalizer;
import nl.bytesoflife.deltaoutline.model.OutlineSource;
import nl.bytesoflife.deltaoutline.model.SourceOutline;
import nl.bytesoflife.deltaoutline.model.Subpath;
import nl.bytesoflife.deltaoutline.parser.PathGrammarException;
import nl.bytesoflife.deltaoutline.parser.PathInterpreter;
import nl.bytesoflife.deltaoutline.parser.PrimitiveShapeExtractor;
import nl.bytesoflife.deltaoutline.svg.SvgDocumentReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the import pipeline for one outline: interpret paths and shapes, normalize,
 * resolve nesting. A path with a grammar error is reported and skipped; the other
 * paths of the same source are still imported.
 */
public class OutlineImporter {

    private static final Logger log = LoggerFactory.getLogger(OutlineImporter.class);

    private final SvgDocumentReader reader = new SvgDocumentReader();
    private final NestingResolver nestingResolver = new NestingResolver();

    public ImportResult importSvg(Path file, ImportOptions options) throws IOException {
        return importOutline(reader.read(file), options);
    }

    public ImportResult importSvg(String xml, String name, ImportOptions options) throws IOException {
        return importOutline(reader.read(xml, name), options);
    }

    public ImportResult importOutline(OutlineSource source, ImportOptions options) {
        long start = System.currentTimeMillis();

        PathInterpreter interpreter = new PathInterpreter(options.toFlatteningBudget());
        PrimitiveShapeExtractor shapeExtractor = new PrimitiveShapeExtractor(options.getEllipseSamples());
        OutlineNormalizer normalizer = new OutlineNormalizer(options.getEpsilon());

        List<Subpath> subpaths = new ArrayList<>();
        List<ImportIssue> issues = new ArrayList<>();

        List<String> pathData = source.pathData();
        for (int i = 0; i < pathData.size(); i++) {
            try {
                subpaths.addAll(interpreter.interpret(pathData.get(i)));
            } catch (PathGrammarException e) {
                log.warn("Skipping path #{} of '{}': {}", i, source.name(), e.getMessage());
                issues.add(new ImportIssue(i, e.getFragment(), e.getPosition(), e.getMessage()));
            }
        }
        subpaths.addAll(shapeExtractor.extract(source.shapes()));

        SourceOutline outline = new SourceOutline(subpaths, source.width(), source.height(), source.viewBox());
        List<Subpath> normalized = normalizer.normalize(outline, options.getTargetSize(), options.getUserScale());
        List<NestedSubpath> profiles = nestingResolver.resolve(normalized);

        ImportResult result = new ImportResult(source.name(), profiles, issues);
        long elapsed = System.currentTimeMillis() - start;
        if (result.getStatus() == ImportResult.Status.NO_CONTENT) {
            log.info("No drawable content in '{}'", source.name());
        } else {
            log.info("Imported '{}': {} profile(s) ({} fills, {} holes), {} issue(s) in {}ms",
                    source.name(), profiles.size(), result.getFillCount(), result.getHoleCount(),
                    issues.size(), elapsed);
        }
        return result;
    }
}
