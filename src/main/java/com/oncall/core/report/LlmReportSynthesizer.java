package com.oncall.core.report;

import com.oncall.core.llm.LlmService;
import com.oncall.core.state.InvestigationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the report with the model from the rendered session, falling back to the
 * rendered session itself when the model call fails.
 */
@Component
public class LlmReportSynthesizer implements ReportSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(LlmReportSynthesizer.class);

    static final String SYSTEM_PROMPT = """
            You are a senior network operations engineer. Write a concise, actionable investigation
            report in Markdown that busy engineers will read. Keep it under 500 words.

            Sections, in order:
            ## Summary - answer the user's question directly in one or two sentences.
            ## Key Findings - the three to five most important facts, as bullets.
            ## Issues & Limitations - problems found, data gaps, failed devices. Omit if none.
            ## Action Items - prioritised HIGH / MEDIUM / LOW recommendations. Omit if none.
            ## Technical Summary - a table with columns Device, Status, Key Metrics, Notes.

            Only state facts present in the investigation data. If the objective was accepted at the
            retry bound, say clearly which devices fell short and why.
            """;

    private final LlmService llmService;
    private final ReportRenderer renderer;

    public LlmReportSynthesizer(LlmService llmService, ReportRenderer renderer) {
        this.llmService = llmService;
        this.renderer = renderer;
    }

    @Override
    public String synthesize(InvestigationState state) {
        String context = renderer.render(state, "Investigation Data");
        try {
            return llmService.textCall(SYSTEM_PROMPT, context);
        } catch (RuntimeException e) {
            log.warn("Report generation failed, using rendered report: {}", e.getMessage());
            return renderer.render(state) + "\n_Report generation failed: " + e.getMessage() + "_\n";
        }
    }
}
