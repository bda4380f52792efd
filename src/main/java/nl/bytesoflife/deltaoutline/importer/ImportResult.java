package nl.bytesoflife.deltaoutline.importer;

import nl.bytesoflife.deltaoutline.extrude.ExtrusionRequest;
import nl.bytesoflife.deltaoutline.geometry.NestedSubpath;
import nl.bytesoflife.deltaoutline.model.ExtrusionStyle;
import nl.bytesoflife.deltaoutline.model.OutlineElement;

import java.util.List;

/**
 * Outcome of importing one outline source.
 */
public class ImportResult {

    public enum Status {
        /** At least one extrudable profile. */
        OK,
        /** Nothing drawable in the source; not a failure. */
        NO_CONTENT,
        /** Paths failed to parse and nothing extrudable remained. */
        FAILED
    }

    private final String name;
    private final List<NestedSubpath> profiles;
    private final List<ImportIssue> issues;

    public ImportResult(String name, List<NestedSubpath> profiles, List<ImportIssue> issues) {
        this.name = name;
        this.profiles = List.copyOf(profiles);
        this.issues = List.copyOf(issues);
    }

    public String getName() {
        return name;
    }

    public List<NestedSubpath> getProfiles() {
        return profiles;
    }

    public List<ImportIssue> getIssues() {
        return issues;
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    public boolean hasContent() {
        return !profiles.isEmpty();
    }

    public Status getStatus() {
        if (hasContent()) return Status.OK;
        return hasIssues() ? Status.FAILED : Status.NO_CONTENT;
    }

    public long getFillCount() {
        return profiles.stream().filter(NestedSubpath::isFill).count();
    }

    public long getHoleCount() {
        return profiles.stream().filter(NestedSubpath::isHole).count();
    }

    public ExtrusionRequest toRequest(double depth, ExtrusionStyle style) {
        return new ExtrusionRequest(profiles, depth, style);
    }

    public ExtrusionRequest toRequest(OutlineElement element) {
        return toRequest(element.getDepth(), element.getStyle());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Import '").append(name).append("': ");
        sb.append(getStatus()).append('\n');
        sb.append("  Profiles: ").append(profiles.size())
          .append(" (").append(getFillCount()).append(" fills, ")
          .append(getHoleCount()).append(" holes)\n");
        for (ImportIssue issue : issues) {
            sb.append("  - ").append(issue).append('\n');
        }
        return sb.toString();
    }
}
