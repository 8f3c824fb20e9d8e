package com.architecture.memory.flowgraph.service.translation;

import com.architecture.memory.flowgraph.config.ConverterProperties;
import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.service.extraction.ParsedMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Turns the raw body of each recovered method into flow graph units and connections.
 *
 * Per method:
 *   1. Lifecycle methods (Start, Update, ...) get an event unit, which becomes the control cursor.
 *   2. Every {@link ConstructHandler} recognizes its construct in the body.
 *   3. Matches are emitted in {@link ScanOrder} sequence; each one is wired from the cursor unit and
 *      then becomes the cursor.
 *   4. Leading comments of a lifecycle method become the event unit description.
 *
 * Methods are translated independently; a fragment never sees another method's units.
 */
@Service
@Slf4j
public class StatementTranslator {

    private final List<ConstructHandler> handlers;
    private final UnitFactory unitFactory;
    private final ConverterProperties properties;

    public StatementTranslator(List<ConstructHandler> handlers, UnitFactory unitFactory,
                               ConverterProperties properties) {
        this.handlers = handlers.stream()
                .sorted(Comparator.comparing(ConstructHandler::category))
                .collect(Collectors.toList());
        this.unitFactory = unitFactory;
        this.properties = properties;
    }

    public List<MethodFragment> translateAll(List<ParsedMethod> methods) {
        List<MethodFragment> fragments = new ArrayList<>();
        for (ParsedMethod method : methods) {
            fragments.add(translate(method));
        }
        return fragments;
    }

    public MethodFragment translate(ParsedMethod method) {
        TranslationContext context = new TranslationContext(method, unitFactory);
        MethodFragment fragment = context.getFragment();

        if (VisualScriptingCatalog.isLifecycleEvent(method.getName())) {
            FlowNode event = context.add(unitFactory.event(method.getName()));
            fragment.setEventNode(event);
            context.getCursor().moveTo(event);
        }

        String body = method.getBody() == null ? "" : method.getBody();
        List<PendingConstruct> constructs = recognizeAll(body);
        if (properties.getScanOrder() == ScanOrder.TEXTUAL) {
            constructs.sort(Comparator.comparingInt(PendingConstruct::offset)
                    .thenComparing(PendingConstruct::category));
        }

        for (PendingConstruct construct : constructs) {
            try {
                construct.emitter().accept(context);
            } catch (RuntimeException e) {
                log.warn("[translator] Skipping {} at offset {} in method {}: {}",
                        construct.category(), construct.offset(), method.getName(), e.getMessage());
            }
        }

        // Only event units carry the method's comment; other methods drop it
        if (fragment.getEventNode() != null && method.getComments() != null && !method.getComments().isEmpty()) {
            fragment.getEventNode().setDescription(method.getComments());
        }

        log.info("[translator] Method {}: event={} constructs={} nodes={} connections={}",
                method.getName(), fragment.getEventNode() != null, constructs.size(),
                fragment.getNodes().size(), fragment.getConnections().size());
        return fragment;
    }

    /**
     * Matches of every handler, grouped by category in precedence order and textual order within a
     * category.
     */
    private List<PendingConstruct> recognizeAll(String body) {
        List<PendingConstruct> constructs = new ArrayList<>();
        for (ConstructHandler handler : handlers) {
            List<ConstructMatch> matches;
            try {
                matches = handler.recognize(body);
            } catch (RuntimeException e) {
                log.warn("[translator] {} recognition failed: {}", handler.category(), e.getMessage());
                continue;
            }
            for (ConstructMatch match : matches) {
                constructs.add(new PendingConstruct(handler.category(), match.getOffset(),
                        context -> handler.emit(match, context)));
            }
        }
        return constructs;
    }

    List<ConstructHandler> getHandlers() {
        return handlers;
    }

    private static final class PendingConstruct {
        private final ConstructCategory category;
        private final int offset;
        private final Consumer<TranslationContext> emitter;

        private PendingConstruct(ConstructCategory category, int offset, Consumer<TranslationContext> emitter) {
            this.category = category;
            this.offset = offset;
            this.emitter = emitter;
        }

        ConstructCategory category() {
            return category;
        }

        int offset() {
            return offset;
        }

        Consumer<TranslationContext> emitter() {
            return emitter;
        }
    }
}
