package com.editguard.core.impact;

public class ExpectedScope {

    private final int       expectedLines;
    private final int       expectedFiles;
    private final ScopeTier tier;
    private final RiskLevel riskLevel;

    public ExpectedScope(int expectedLines, int expectedFiles, ScopeTier tier, RiskLevel riskLevel) {
        this.expectedLines = Math.max(0, expectedLines);
        this.expectedFiles = Math.max(1, expectedFiles);
        this.tier          = tier      != null ? tier      : ScopeTier.forExpectedLines(expectedLines);
        this.riskLevel     = riskLevel != null ? riskLevel : RiskLevel.MEDIUM;
    }

    public int       getExpectedLines() { return expectedLines; }
    public int       getExpectedFiles() { return expectedFiles; }
    public ScopeTier getTier()          { return tier; }
    public RiskLevel getRiskLevel()     { return riskLevel; }

    @Override
    public String toString() {
        return String.format("ExpectedScope{lines=%d, files=%d, tier=%s, risk=%s}",
                expectedLines, expectedFiles, tier, riskLevel);
    }
}
