package com.architecture.memory.flowgraph.service.translation;

import com.architecture.memory.flowgraph.model.graph.FlowNode;
import com.architecture.memory.flowgraph.model.graph.FlowPort;
import com.architecture.memory.flowgraph.model.graph.MemberDescriptor;
import com.architecture.memory.flowgraph.model.graph.NodeCategory;
import com.architecture.memory.flowgraph.service.extraction.ParsedParameter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.architecture.memory.flowgraph.model.graph.PortType.CONTROL_INPUT;
import static com.architecture.memory.flowgraph.model.graph.PortType.CONTROL_OUTPUT;
import static com.architecture.memory.flowgraph.model.graph.PortType.VALUE_INPUT;
import static com.architecture.memory.flowgraph.model.graph.PortType.VALUE_OUTPUT;
import static com.architecture.memory.flowgraph.service.translation.VisualScriptingCatalog.*;

/**
 * Builds unit templates with the port layout each Visual Scripting unit kind declares.
 * Templates carry no guid, position or arena index; those are stamped during assembly.
 */
@Component
public class UnitFactory {

    public static final String ENTER = "enter";
    public static final String EXIT = "exit";
    public static final String TRIGGER = "trigger";
    public static final String OUTPUT = "output";
    public static final String RESULT = "result";

    public FlowNode event(String methodName) {
        return unit(findEventUnit(methodName).orElse(UNIT_NAMESPACE + "Start"), NodeCategory.EVENT,
                List.of(FlowPort.of(TRIGGER, CONTROL_OUTPUT)));
    }

    /**
     * Literal unit holding {@code value}. The C# type name is mapped to its runtime type.
     */
    public FlowNode literal(Object value, String csType) {
        String type = mapType(csType);

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("$content", value);
        content.put("$type", type);

        FlowNode node = unit(LITERAL, NodeCategory.DATA, List.of(FlowPort.of(OUTPUT, VALUE_OUTPUT, type)));
        node.getDefaultValues().put("type", type);
        node.getDefaultValues().put("value", content);
        return node;
    }

    public FlowNode forLoop() {
        return unit(FOR, NodeCategory.FLOW, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of("firstIndex", VALUE_INPUT, SYSTEM_INT32),
                FlowPort.of("lastIndex", VALUE_INPUT, SYSTEM_INT32),
                FlowPort.of("step", VALUE_INPUT, SYSTEM_INT32),
                FlowPort.of("body", CONTROL_OUTPUT),
                FlowPort.of(EXIT, CONTROL_OUTPUT),
                FlowPort.of("currentIndex", VALUE_OUTPUT, SYSTEM_INT32)));
    }

    public FlowNode whileLoop() {
        return unit(WHILE, NodeCategory.FLOW, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of("condition", VALUE_INPUT, SYSTEM_BOOLEAN),
                FlowPort.of("body", CONTROL_OUTPUT),
                FlowPort.of(EXIT, CONTROL_OUTPUT)));
    }

    public FlowNode forEachLoop() {
        return unit(FOR_EACH, NodeCategory.FLOW, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of("collection", VALUE_INPUT, "System.Collections.IEnumerable"),
                FlowPort.of("body", CONTROL_OUTPUT),
                FlowPort.of(EXIT, CONTROL_OUTPUT),
                FlowPort.of("currentItem", VALUE_OUTPUT, SYSTEM_OBJECT)));
    }

    /**
     * Integer switch with one control output per case label, named "0".."n-1", plus "default".
     */
    public FlowNode switchOnInteger(int caseCount) {
        List<FlowPort> ports = new ArrayList<>();
        ports.add(FlowPort.of(ENTER, CONTROL_INPUT));
        ports.add(FlowPort.of("selector", VALUE_INPUT, SYSTEM_INT32));
        for (int i = 0; i < caseCount; i++) {
            ports.add(FlowPort.of(String.valueOf(i), CONTROL_OUTPUT));
        }
        ports.add(FlowPort.of("default", CONTROL_OUTPUT));
        return unit(SWITCH_ON_INTEGER, NodeCategory.FLOW, ports);
    }

    public FlowNode branch() {
        return unit(IF, NodeCategory.FLOW, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of("condition", VALUE_INPUT, SYSTEM_BOOLEAN),
                FlowPort.of("true", CONTROL_OUTPUT),
                FlowPort.of("false", CONTROL_OUTPUT)));
    }

    public FlowNode comparison(ComparisonOperator operator) {
        return unit(operator.getUnitType(), NodeCategory.OPERATOR, List.of(
                FlowPort.of("a", VALUE_INPUT, SYSTEM_OBJECT),
                FlowPort.of("b", VALUE_INPUT, SYSTEM_OBJECT),
                FlowPort.of(RESULT, VALUE_OUTPUT, SYSTEM_BOOLEAN)));
    }

    public FlowNode arithmetic(ArithmeticOperator operator) {
        return unit(operator.getUnitType(), NodeCategory.OPERATOR, List.of(
                FlowPort.of("a", VALUE_INPUT, SYSTEM_OBJECT),
                FlowPort.of("b", VALUE_INPUT, SYSTEM_OBJECT),
                FlowPort.of(RESULT, VALUE_OUTPUT, SYSTEM_OBJECT)));
    }

    public FlowNode setVariable(String name, String type) {
        FlowNode node = unit(SET_VARIABLE, NodeCategory.VARIABLE, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of(EXIT, CONTROL_OUTPUT),
                FlowPort.of("input", VALUE_INPUT, type)));
        node.getDefaultValues().put("name", name);
        return node;
    }

    public FlowNode yieldReturn() {
        return unit(YIELD_RETURN, NodeCategory.FLOW, List.of(
                FlowPort.of(ENTER, CONTROL_INPUT),
                FlowPort.of(EXIT, CONTROL_OUTPUT),
                FlowPort.of("instruction", VALUE_INPUT, "UnityEngine.YieldInstruction")));
    }

    public FlowNode waitForSeconds(float seconds) {
        FlowNode node = unit(WAIT_FOR_SECONDS, NodeCategory.DATA, List.of(
                FlowPort.of("seconds", VALUE_INPUT, SYSTEM_SINGLE),
                FlowPort.of(RESULT, VALUE_OUTPUT, "UnityEngine.WaitForSeconds")));
        node.getDefaultValues().put("seconds", seconds);
        return node;
    }

    /**
     * Static {@code UnityEngine.Debug.Log(object message)} invocation.
     */
    public FlowNode debugLog() {
        MemberDescriptor member = MemberDescriptor.builder()
                .name("Log")
                .targetType("UnityEngine.Debug")
                .parameterTypes(List.of(SYSTEM_OBJECT))
                .isStatic(true)
                .build();

        return invoke(member, List.of(FlowPort.of("message", VALUE_INPUT, SYSTEM_OBJECT)));
    }

    /**
     * Invocation of a member recovered from a call site. Instance members get a {@code target} input;
     * a non-void return type adds a {@code result} output.
     */
    public FlowNode memberInvoke(String methodName, String targetType, List<ParsedParameter> parameters,
                                 String returnType, boolean isStatic) {
        List<String> parameterTypes = parameters.stream()
                .map(p -> mapType(p.getType()))
                .collect(Collectors.toList());
        List<String> parameterNames = parameters.stream()
                .map(ParsedParameter::getName)
                .collect(Collectors.toList());

        MemberDescriptor member = MemberDescriptor.builder()
                .name(methodName)
                .targetType(targetType)
                .parameterTypes(parameterTypes)
                .parameterNames(parameterNames)
                .isStatic(isStatic)
                .build();

        List<FlowPort> valuePorts = new ArrayList<>();
        if (!isStatic) {
            valuePorts.add(FlowPort.of("target", VALUE_INPUT, targetType));
        }
        for (int i = 0; i < parameters.size(); i++) {
            valuePorts.add(FlowPort.of(parameterNames.get(i), VALUE_INPUT, parameterTypes.get(i)));
        }
        if (returnType != null && !"void".equals(returnType)) {
            valuePorts.add(FlowPort.of(RESULT, VALUE_OUTPUT, mapType(returnType)));
        }
        return invoke(member, valuePorts);
    }

    private FlowNode invoke(MemberDescriptor member, List<FlowPort> valuePorts) {
        List<FlowPort> ports = new ArrayList<>();
        ports.add(FlowPort.of(ENTER, CONTROL_INPUT));
        ports.add(FlowPort.of(EXIT, CONTROL_OUTPUT));
        ports.addAll(valuePorts);

        FlowNode node = unit(INVOKE_MEMBER, NodeCategory.INVOKE, ports);
        node.setMember(member);
        return node;
    }

    private FlowNode unit(String unitType, NodeCategory category, List<FlowPort> ports) {
        return FlowNode.builder()
                .unitType(unitType)
                .category(category)
                .ports(new ArrayList<>(ports))
                .build();
    }
}
