package com.architecture.memory.flowgraph.service.translation.handler;

import com.architecture.memory.flowgraph.service.translation.ConstructHandler;
import com.architecture.memory.flowgraph.service.translation.ConstructMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for handlers that recognize their construct with a single regular expression.
 */
public abstract class AbstractPatternHandler implements ConstructHandler {

    protected abstract Pattern pattern();

    /**
     * Named groups copied into each {@link ConstructMatch}.
     */
    protected abstract String[] captureNames();

    @Override
    public List<ConstructMatch> recognize(String body) {
        List<ConstructMatch> matches = new ArrayList<>();
        if (body == null || body.isEmpty()) {
            return matches;
        }

        Matcher matcher = pattern().matcher(body);
        while (matcher.find()) {
            ConstructMatch match = ConstructMatch.of(category(), matcher, captureNames());
            if (accept(match, body)) {
                matches.add(refine(match, body));
            }
        }
        return matches;
    }

    /**
     * Filter hook for matches the pattern alone cannot rule out.
     */
    protected boolean accept(ConstructMatch match, String body) {
        return true;
    }

    /**
     * Hook for attaching facts that need the surrounding body text.
     */
    protected ConstructMatch refine(ConstructMatch match, String body) {
        return match;
    }
}
