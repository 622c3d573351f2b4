package com.mlops.cleanup.report;

import com.mlops.cleanup.model.Classification;
import com.mlops.cleanup.model.CleanupPlan;
import com.mlops.cleanup.model.ExecutionMode;
import com.mlops.cleanup.model.ExecutionResult;
import com.mlops.cleanup.model.HealthFinding;
import com.mlops.cleanup.model.ItemOutcome;
import com.mlops.cleanup.model.ItemResult;
import com.mlops.cleanup.model.PlannedDeletion;
import com.mlops.cleanup.model.ResourceKind;
import com.mlops.cleanup.model.ScanResult;
import com.mlops.cleanup.model.SequenceGroup;
import com.mlops.cleanup.model.Verdict;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Line-oriented console reports. Everything goes to the given stream so tests can capture it.
 */
public class ReportRenderer {

    private static final String RULE = "─────────────────────────────────────────────────────────────────";
    private static final String DOUBLE_RULE = "═══════════════════════════════════════════════════════════════════";

    private final PrintStream out;
    private final boolean verbose;

    public ReportRenderer(PrintStream out, boolean verbose) {
        this.out = out;
        this.verbose = verbose;
    }

    public void printBanner(String title) {
        out.println("╔══════════════════════════════════════════════════════════════════╗");
        out.printf("║  %-64s║%n", title);
        out.println("╚══════════════════════════════════════════════════════════════════╝");
        out.println();
    }

    public void printInventory(ScanResult scan) {
        out.println("📊 Resource inventory:");
        Map<ResourceKind, Long> counts = scan.getCountsByKind();
        for (ResourceKind kind : ResourceKind.values()) {
            if (scan.getFailedKinds().contains(kind)) {
                out.printf("   %-28s ⚠️  listing failed%n", kind.getDisplayName());
            } else {
                out.printf("   %-28s %d%n", kind.getDisplayName(), counts.getOrDefault(kind, 0L));
            }
        }
        out.println();
    }

    /**
     * Advisory report of the check command: what is orphaned and what needs a human.
     */
    public void printCheck(List<Classification> classifications, List<HealthFinding> failingWorkloads) {
        Map<Verdict, List<Classification>> byVerdict = new EnumMap<>(Verdict.class);
        for (Classification classification : classifications) {
            byVerdict.computeIfAbsent(classification.getVerdict(), v -> new ArrayList<>()).add(classification);
        }
        List<Classification> orphaned = byVerdict.getOrDefault(Verdict.ORPHANED, List.of());
        List<Classification> review = byVerdict.getOrDefault(Verdict.NEEDS_REVIEW, List.of());
        List<Classification> managed = byVerdict.getOrDefault(Verdict.MANAGED, List.of());

        out.println("🔍 Ownership check:");
        out.println();
        printClassifications("❌ Orphaned", orphaned);
        printClassifications("⚠️  Needs review", review);
        if (verbose) {
            printClassifications("✅ Managed", managed);
        }
        printFailingWorkloads(failingWorkloads);

        out.println(RULE);
        out.printf("Managed: %d   Orphaned: %d   Needs review: %d   Failing workloads: %d%n",
                managed.size(), orphaned.size(), review.size(), failingWorkloads.size());
        if (orphaned.isEmpty() && review.isEmpty() && failingWorkloads.isEmpty()) {
            out.println("✅ Cluster matches the platform baseline");
        }
        out.println();
    }

    private void printFailingWorkloads(List<HealthFinding> findings) {
        if (findings.isEmpty()) {
            return;
        }
        out.printf("┌─ 🔥 Failing workloads (%d)%n", findings.size());
        for (HealthFinding finding : findings) {
            out.printf("│  • %-60s [%s]%n", finding.getDescriptor().getDisplayId(), finding.getProblem());
        }
        out.println("└" + RULE);
        out.println();
    }

    private void printClassifications(String heading, List<Classification> classifications) {
        if (classifications.isEmpty()) {
            return;
        }
        out.printf("┌─ %s (%d)%n", heading, classifications.size());
        for (Classification classification : classifications) {
            out.printf("│  • %-60s [%s]%n", classification.getDescriptor().getDisplayId(), classification.getReason());
        }
        out.println("└" + RULE);
        out.println();
    }

    public void printPlan(CleanupPlan plan, ExecutionMode mode) {
        out.println(mode == ExecutionMode.DRY_RUN ? "📋 Cleanup plan (dry run, nothing will be changed):"
                : "📋 Cleanup plan:");
        out.println();

        if (plan.isEmpty()) {
            out.println("✅ No orphaned resources found");
            out.println();
        }

        for (Map.Entry<SequenceGroup, List<PlannedDeletion>> entry : plan.getDeletionsByGroup().entrySet()) {
            SequenceGroup group = entry.getKey();
            out.printf("┌─ Group %d: %s (%d)%n", group.getOrder(), group.getDescription(), entry.getValue().size());
            Map<ResourceKind, List<PlannedDeletion>> byKind = new TreeMap<>();
            for (PlannedDeletion deletion : entry.getValue()) {
                byKind.computeIfAbsent(deletion.getDescriptor().getKind(), k -> new ArrayList<>()).add(deletion);
            }
            for (Map.Entry<ResourceKind, List<PlannedDeletion>> kindEntry : byKind.entrySet()) {
                out.printf("│  %s (%d):%n", kindEntry.getKey().getDisplayName(), kindEntry.getValue().size());
                for (PlannedDeletion deletion : kindEntry.getValue()) {
                    out.printf("│    • %-58s [%s]%n", deletion.getDescriptor().getQualifiedName(),
                            deletion.getVerdictReason());
                }
            }
            out.println("└" + RULE);
            out.println();
        }

        if (!plan.getAdvisories().isEmpty()) {
            printClassifications("⚠️  Needs review, will not be deleted", plan.getAdvisories());
        }

        out.printf("Planned deletions: %d   Needs review: %d%n", plan.size(), plan.getAdvisories().size());
        out.println();
    }

    public void printExecution(ExecutionResult result) {
        out.println(DOUBLE_RULE);
        out.println();
        out.println(result.getMode() == ExecutionMode.DRY_RUN ? "📊 Dry-run summary:" : "📊 Cleanup summary:");
        out.println();

        for (Map.Entry<ResourceKind, Map<ItemOutcome, Integer>> entry : result.getCountsByKind().entrySet()) {
            out.printf("   %-28s %s%n", entry.getKey().getDisplayName(), formatCounts(entry.getValue()));
        }
        out.println();

        List<ItemResult> failed = new ArrayList<>();
        for (ItemResult item : result.getItems()) {
            if (item.getOutcome() == ItemOutcome.FAILED) {
                failed.add(item);
            }
        }
        if (!failed.isEmpty()) {
            out.printf("┌─ ❌ Failed (%d)%n", failed.size());
            for (ItemResult item : failed) {
                out.printf("│  • %s: %s%n", item.getDeletion().getDescriptor().getDisplayId(), item.getErrorMessage());
            }
            out.println("└" + RULE);
            out.println();
        }

        if (verbose) {
            for (ItemResult item : result.getItems()) {
                out.printf("   %-10s %s%n", item.getOutcome(), item.getDeletion().getDescriptor().getDisplayId());
            }
            out.println();
        }

        out.printf("Total: %d   %s%n", result.getItems().size(), formatCounts(result.getCountsByOutcome()));
        out.printf("Outcome: %s%n", result.getOutcome());
        out.println();
    }

    public void printAborted(String reason) {
        out.println();
        out.println("❌ Run aborted: " + reason);
        out.println("   No resources were deleted.");
        out.println();
    }

    public void printCancelled() {
        out.println();
        out.println("🚫 Cleanup cancelled. No resources were deleted.");
        out.println();
    }

    public void printInterrupted() {
        out.println();
        out.println("⚠️  Run interrupted. Groups that had not started were skipped.");
        out.println();
    }

    private static String formatCounts(Map<ItemOutcome, Integer> counts) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<ItemOutcome, Integer> entry : counts.entrySet()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry.getKey().name().toLowerCase(Locale.ROOT).replace('_', '-')).append('=').append(entry.getValue());
        }
        return sb.toString();
    }
}
