package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.extraction.BraceBlockScanner;
import com.architecture.memory.flowgraph.service.translation.ConstructCategory;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;
import com.architecture.memory.flowgraph.service.translation.TranslationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code switch (selector) { case 0: ... }} over integer labels.
 *
 * The case count comes from the integer {@code case N:} labels inside the brace-balanced switch body.
 * The selector input is left unconnected.
 */
@Component
@Slf4j
public class SwitchHandler extends AbstractPatternHandler {

    static final String CASE_COUNT = "caseCount";

    private static final Pattern SWITCH_PATTERN = Pattern.compile("\\bswitch\\s*\\((?<selector>[^)]+)\\)\\s*\\{");

    private static final Pattern INTEGER_CASE_PATTERN = Pattern.compile("\\bcase\\s+\\d+\\s*:");

    @Override
    public ConstructCategory category() {
        return ConstructCategory.SWITCH;
    }

    @Override
    protected Pattern pattern() {
        return SWITCH_PATTERN;
    }

    @Override
    protected String[] captureNames() {
        return new String[]{"selector"};
    }

    @Override
    protected ConstructMatch refine(ConstructMatch match, String body) {
        int openBrace = match.getOffset() + match.getText().length() - 1;
        String switchBody = BraceBlockScanner.extractBlock(body, openBrace).orElse("");
        return match.withCapture(CASE_COUNT, String.valueOf(countIntegerCases(switchBody)));
    }

    @Override
    public void emit(ConstructMatch match, TranslationContext context) {
        int caseCount = Integer.parseInt(match.capture(CASE_COUNT).orElse("0"));
        FlowNode switchNode = context.add(context.getUnits().switchOnInteger(caseCount));
        context.enterControl(switchNode);
        log.debug("[translator] switch ({}) with {} integer case(s)", match.captureOrEmpty("selector").trim(), caseCount);
    }

    static int countIntegerCases(String switchBody) {
        Matcher matcher = INTEGER_CASE_PATTERN.matcher(switchBody);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
