package com.architecture.memory.flowgraph.service.translation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit type names and C# to runtime type mappings of the Unity Visual Scripting schema.
 */
public final class VisualScriptingCatalog {

    public static final String UNIT_NAMESPACE = "Unity.VisualScripting.";

    public static final String LITERAL = UNIT_NAMESPACE + "Literal";
    public static final String INVOKE_MEMBER = UNIT_NAMESPACE + "InvokeMember";
    public static final String IF = UNIT_NAMESPACE + "If";
    public static final String FOR = UNIT_NAMESPACE + "For";
    public static final String WHILE = UNIT_NAMESPACE + "While";
    public static final String FOR_EACH = UNIT_NAMESPACE + "ForEach";
    public static final String SWITCH_ON_INTEGER = UNIT_NAMESPACE + "SwitchOnInteger";
    public static final String YIELD_RETURN = UNIT_NAMESPACE + "YieldReturn";
    public static final String WAIT_FOR_SECONDS = UNIT_NAMESPACE + "WaitForSeconds";
    public static final String SET_VARIABLE = UNIT_NAMESPACE + "SetVariable";

    public static final String CONTROL_CONNECTION = UNIT_NAMESPACE + "ControlConnection";
    public static final String VALUE_CONNECTION = UNIT_NAMESPACE + "ValueConnection";

    public static final String SYSTEM_OBJECT = "System.Object";
    public static final String SYSTEM_BOOLEAN = "System.Boolean";
    public static final String SYSTEM_INT32 = "System.Int32";
    public static final String SYSTEM_SINGLE = "System.Single";
    public static final String SYSTEM_STRING = "System.String";

    /**
     * Lifecycle and callback methods of a MonoBehaviour that start graph execution.
     */
    private static final Map<String, String> LIFECYCLE_EVENTS = new LinkedHashMap<>();

    static {
        for (String event : new String[]{
                "Start", "Update", "Awake", "OnEnable", "OnDisable", "OnDestroy", "FixedUpdate",
                "LateUpdate", "OnTriggerEnter", "OnTriggerExit", "OnTriggerStay", "OnCollisionEnter",
                "OnCollisionExit", "OnCollisionStay"}) {
            LIFECYCLE_EVENTS.put(event, UNIT_NAMESPACE + event);
        }
    }

    private static final Map<String, String> TYPE_MAPPINGS = Map.of(
            "int", SYSTEM_INT32,
            "float", SYSTEM_SINGLE,
            "double", "System.Double",
            "bool", SYSTEM_BOOLEAN,
            "string", SYSTEM_STRING,
            "Vector2", "UnityEngine.Vector2",
            "Vector3", "UnityEngine.Vector3",
            "Quaternion", "UnityEngine.Quaternion",
            "GameObject", "UnityEngine.GameObject",
            "Transform", "UnityEngine.Transform"
    );

    // Receivers that are known engine types rather than fields or locals
    private static final Set<String> ENGINE_RECEIVERS = Set.of("GameObject", "Transform", "Rigidbody");

    private VisualScriptingCatalog() {
    }

    public static Optional<String> findEventUnit(String methodName) {
        return Optional.ofNullable(LIFECYCLE_EVENTS.get(methodName));
    }

    public static boolean isLifecycleEvent(String methodName) {
        return LIFECYCLE_EVENTS.containsKey(methodName);
    }

    /**
     * Runtime type for a C# type name; unknown names pass through unchanged.
     */
    public static String mapType(String csType) {
        return TYPE_MAPPINGS.getOrDefault(csType, csType);
    }

    public static String receiverType(String receiver) {
        return ENGINE_RECEIVERS.contains(receiver) ? "UnityEngine." + receiver : receiver;
    }
}
