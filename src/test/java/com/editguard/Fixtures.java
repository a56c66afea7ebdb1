package com.editguard;

import com.editguard.core.impact.CascadeChange;
import com.editguard.core.impact.ChangeImpactAnalysis;
import com.editguard.core.impact.DirectChange;
import com.editguard.core.impact.ExpectedScope;
import com.editguard.core.impact.PreservationRule;
import com.editguard.core.impact.RiskLevel;
import com.editguard.core.impact.ScopeTier;
import com.editguard.core.impact.ValidationCheck;
import com.editguard.core.repo.ComplexityTier;
import com.editguard.core.repo.ComponentProp;
import com.editguard.core.repo.DesignTokens;
import com.editguard.core.repo.RepoContext;
import com.editguard.core.repo.StylingApproach;
import com.editguard.core.repo.StylingPatterns;
import com.editguard.core.repo.TargetComponent;
import com.editguard.core.request.ChangeRequest;
import com.editguard.core.request.PropertyEdit;
import com.editguard.core.request.TargetElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: one small React button, a well-described repository,
 * an empty one, and the impact analyses the scenario tests run against.
 */
public final class Fixtures {

    public static final String BUTTON_PATH = "src/components/Button.tsx";

    public static final String BUTTON_SOURCE = """
            import React, { useState } from 'react';
            import { clsx } from 'clsx';

            export interface ButtonProps {
              label: string;
              variant?: 'primary' | 'secondary';
              disabled?: boolean;
              onClick?: () => void;
            }

            const baseStyle = {
              fontSize: '14px',
              backgroundColor: 'blue',
              padding: '8px 16px',
            };

            export default function Button({ label, variant = 'primary', disabled = false, onClick }: ButtonProps) {
              const [pressed, setPressed] = useState(false);

              const handleClick = () => {
                if (disabled) {
                  return;
                }
                setPressed(true);
                onClick?.();
              };

              return (
                <button
                  className={clsx('btn-primary', 'rounded', variant === 'primary' ? 'text-white' : 'text-gray-800')}
                  style={baseStyle}
                  disabled={disabled}
                  aria-pressed={pressed}
                  onClick={handleClick}
                >
                  {label}
                </button>
              );
            }""";

    /** The button with its background given as a hex literal. */
    public static final String HEX_BUTTON_SOURCE =
            BUTTON_SOURCE.replace("backgroundColor: 'blue'", "backgroundColor: '#1F2937'");

    private Fixtures() {}

    // ----------------------------------------------------------------
    // Requests
    // ----------------------------------------------------------------

    public static ChangeRequest fontSizeRequest() {
        return new ChangeRequest(
                new TargetElement("button", ".btn-primary", "btn-primary rounded"),
                List.of(PropertyEdit.styling("font-size", "14px", "16px")),
                "Increase the font size of the primary button");
    }

    public static ChangeRequest backgroundColorRequest() {
        return new ChangeRequest(
                new TargetElement("button", ".btn-primary", "btn-primary rounded"),
                List.of(PropertyEdit.styling("background-color", "blue", "red")),
                "Change the background color of the primary button to red");
    }

    public static ChangeRequest hexBackgroundRequest() {
        return new ChangeRequest(
                TargetElement.of("button", "button.btn-primary"),
                List.of(PropertyEdit.styling("background-color", "#1F2937", "#3B82F6")),
                "Change the primary button background from dark gray to blue");
    }

    public static ChangeRequest vagueRequest() {
        return new ChangeRequest(TargetElement.of("div", ""), List.of(), "make it look better");
    }

    // ----------------------------------------------------------------
    // Components and repositories
    // ----------------------------------------------------------------

    public static TargetComponent button() {
        return button(BUTTON_SOURCE);
    }

    public static TargetComponent button(String content) {
        return TargetComponent.builder("Button", BUTTON_PATH)
                .framework("react")
                .complexity(ComplexityTier.SIMPLE)
                .stylingApproach(StylingApproach.TAILWIND)
                .props(List.of(
                        new ComponentProp("label", "string", true),
                        new ComponentProp("variant", "'primary' | 'secondary'", false),
                        new ComponentProp("onClick", "() => void", false)))
                .exports(List.of("Button", "ButtonProps"))
                .imports(List.of("react", "clsx"))
                .cssClasses(List.of("btn-primary", "rounded"))
                .inlineStyles(true)
                .content(content)
                .build();
    }

    /** Same source, but nothing known about it. */
    public static TargetComponent opaqueButton() {
        return TargetComponent.builder("Button", BUTTON_PATH)
                .complexity(ComplexityTier.COMPLEX)
                .stylingApproach(StylingApproach.UNKNOWN)
                .content(BUTTON_SOURCE)
                .build();
    }

    /** Twenty components, design tokens, observed patterns, DOM mappings and rules. */
    public static RepoContext richRepo() {
        List<TargetComponent> components = new ArrayList<>();
        components.add(button());
        for (int i = 1; i < 20; i++) {
            components.add(TargetComponent.builder("Widget" + i, "src/components/Widget" + i + ".tsx").build());
        }

        return RepoContext.builder("acme-web")
                .primaryFramework("react")
                .frameworkVersion("18.2.0")
                .stylingApproach(StylingApproach.TAILWIND)
                .components(components)
                .designTokens(new DesignTokens(
                        Map.of("primary", "#2563eb", "danger", "#dc2626"),
                        Map.of("sm", "8px", "md", "16px"),
                        Map.of("base", "16px", "sm", "14px")))
                .stylingPatterns(new StylingPatterns(
                        Map.of("14px", 12, "16px", 30),
                        Map.of("blue", 8, "red", 3),
                        Map.of("8px", 20)))
                .domMappings(Map.of(".btn-primary", List.of("Button")))
                .transformationRules(List.of("font-size maps to text-* utilities"))
                .analysisConfidence(0.9)
                .build();
    }

    public static RepoContext emptyRepo() {
        return RepoContext.empty("unknown-repo");
    }

    // ----------------------------------------------------------------
    // Impact analyses
    // ----------------------------------------------------------------

    /** One direct change per edit, minimal scope, low risk, critical structure rules. */
    public static ChangeImpactAnalysis minimalImpact(ChangeRequest request) {
        List<DirectChange> direct = new ArrayList<>();
        for (PropertyEdit edit : request.getEdits()) {
            direct.add(new DirectChange(DirectChange.Type.INLINE_STYLE, "baseStyle", edit.getProperty(),
                    edit.getBefore(), edit.getAfter(), 0.9));
        }
        return new ChangeImpactAnalysis(
                new ExpectedScope(2, 1, ScopeTier.MINIMAL, RiskLevel.LOW),
                direct,
                List.of(),
                structureRules(),
                List.of(
                        new ValidationCheck(ValidationCheck.Type.SYNTAX, "Syntax check", true),
                        new ValidationCheck(ValidationCheck.Type.INTENT_ALIGNMENT, "Intent check", true)));
    }

    /** Major scope, high risk, one required design-system cascade. */
    public static ChangeImpactAnalysis majorImpact() {
        return new ChangeImpactAnalysis(
                new ExpectedScope(40, 3, ScopeTier.MAJOR, RiskLevel.HIGH),
                List.of(),
                List.of(new CascadeChange(CascadeChange.Type.DESIGN_SYSTEM, "design tokens",
                        "Unclear request may touch shared tokens", true, 0.4)),
                structureRules(),
                List.of(new ValidationCheck(ValidationCheck.Type.PRESERVATION, "Preservation check", true)));
    }

    public static List<PreservationRule> structureRules() {
        return List.of(
                PreservationRule.critical(PreservationRule.Type.STRUCTURE, "Component exports",
                        "export\\s+(default\\s+)?(function|const|class)"),
                PreservationRule.critical(PreservationRule.Type.STRUCTURE, "Import statements",
                        "import\\s+.*from\\s+['\"][^'\"]+['\"]"),
                PreservationRule.critical(PreservationRule.Type.FUNCTIONALITY, "Hooks and functions",
                        "use\\w+\\(|function\\s+\\w+|const\\s+\\w+\\s*="));
    }
}
