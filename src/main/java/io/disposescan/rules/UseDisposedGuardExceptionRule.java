package io.disposescan.rules;

import io.disposescan.analysis.MalformedMethodBodyException;
import io.disposescan.analysis.MethodBodyValidator;
import io.disposescan.analysis.ReceiverTracer;
import io.disposescan.config.RuleConfig;
import io.disposescan.model.Confidence;
import io.disposescan.model.FieldRef;
import io.disposescan.model.Instruction;
import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.MethodRef;
import io.disposescan.model.OpCodeBitmask;
import io.disposescan.model.Severity;
import io.disposescan.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Public methods of a closeable type should refuse to work once the object is closed.
 * <p>
 * A public method is reported when it calls a non-public instance method of its own class on
 * {@code this}, or reads or writes one of its own instance fields on {@code this}, and nowhere
 * in its body either allocates the guard exception or calls a helper whose name marks it as a
 * closed check (by default: contains both "Check" and "Dispose").
 * <p>
 * Methods that are allowed to work on a closed object are never checked: constructors,
 * finalizers, property getters, listener registration and fire methods, {@code equals(x)},
 * {@code hashCode()}, {@code toString()}, {@code close()} and the dispose method itself.
 * Generated methods are skipped as their instructions do not reflect written code.
 * <p>
 * The evidence is syntactic. A guard exception allocated on an unrelated path still
 * counts as a check, and a helper that checks but is named otherwise does not.
 * <p>
 * Bad example:
 * <pre>
 * public final class WriteStuff implements Closeable {
 *     private final Writer writer;
 *     private boolean closed;
 *
 *     public void write(String message) throws IOException {
 *         writer.write(message);
 *     }
 *
 *     public void close() throws IOException {
 *         if (!closed) {
 *             writer.close();
 *             closed = true;
 *         }
 *     }
 * }
 * </pre>
 * Good example:
 * <pre>
 *     public void write(String message) throws IOException {
 *         if (closed) {
 *             throw new IllegalStateException(getClass().getSimpleName() + " is closed");
 *         }
 *         writer.write(message);
 *     }
 * </pre>
 */
public class UseDisposedGuardExceptionRule implements MethodRule {

    private static final Logger log = LoggerFactory.getLogger(UseDisposedGuardExceptionRule.class);

    public static final String ID = "use-disposed-guard-exception";

    private final ReceiverTracer tracer;

    public UseDisposedGuardExceptionRule() {
        this(new ReceiverTracer());
    }

    public UseDisposedGuardExceptionRule(ReceiverTracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String problem() {
        return "A public method of a closeable type does not throw the guard exception after the object has been closed.";
    }

    @Override
    public String solution() {
        return "Throw the guard exception from public methods once close() has run.";
    }

    @Override
    public RuleResult checkMethod(MethodInfo method, AnalysisContext context, FindingSink sink) {
        if (!method.hasBody()) {
            return RuleResult.DOES_NOT_APPLY;
        }

        // Synthetic bodies (lambdas, bridges, generated accessors) do not reflect written code
        if (context.generatedCode().isGeneratedCode(method)) {
            return RuleResult.DOES_NOT_APPLY;
        }

        if (!isEligible(method, context)) {
            return RuleResult.DOES_NOT_APPLY;
        }

        log.debug("-----------------------------------------");
        log.debug("{}", method);

        GuardScanState state;
        try {
            MethodBodyValidator.validate(method);
            state = scan(method, context);
        } catch (MalformedMethodBodyException e) {
            log.warn("Skipping {}: {}", method, e.getMessage());
            return RuleResult.MALFORMED;
        }

        if (state.violates()) {
            sink.report(method, Severity.MEDIUM, Confidence.HIGH);
            return RuleResult.FAILURE;
        }
        return RuleResult.SUCCESS;
    }

    /**
     * Returns true if the method is public, touches calls or fields at all, belongs to a type
     * implementing the lifecycle interface, and is not one of the methods allowed to work
     * on a closed object.
     */
    public boolean isEligible(MethodInfo method, AnalysisContext context) {
        if (!method.isPublic()) {
            return false;
        }
        if (!OpCodeBitmask.summarize(method).intersects(OpCodeBitmask.CALLS_AND_FIELDS)) {
            return false;
        }
        if (!context.hierarchy().implementsInterface(method.declaringType(), context.config().lifecycleInterface())) {
            return false;
        }
        return allowedToThrow(method, context.config());
    }

    // Methods that must keep working after close()
    static boolean allowedToThrow(MethodInfo method, RuleConfig config) {
        if (method.is(MethodFlag.CONSTRUCTOR)) {
            return false;
        }
        if (method.is(MethodFlag.FINALIZER)) {
            return false;
        }
        if (method.is(MethodFlag.PROPERTY_GETTER)) {
            return false;
        }
        if (method.is(MethodFlag.EVENT_ACCESSOR)) {
            return false;
        }
        if (isEquals(method)) {
            return false;
        }
        if (matches(method, "hashCode", "()I")) {
            return false;
        }
        if (matches(method, "toString", "()Ljava/lang/String;")) {
            return false;
        }
        if (matches(method, "close", "()V")) {
            return false;
        }
        return !method.name().equals(config.disposeMethod());
    }

    private static boolean isEquals(MethodInfo method) {
        return method.name().equals("equals")
                && method.parameterCount() == 1
                && "boolean".equals(method.returnType());
    }

    private static boolean matches(MethodInfo method, String name, String descriptor) {
        return method.name().equals(name) && method.descriptor().equals(descriptor);
    }

    /**
     * Walks the body once, in offset order, and records what it finds.
     */
    GuardScanState scan(MethodInfo method, AnalysisContext context) {
        GuardScanState state = new GuardScanState();
        String owner = method.declaringType();
        RuleConfig config = context.config();

        for (Instruction ins : method.instructions()) {
            switch (ins.opCode()) {
                case INVOKE_DIRECT, INVOKE_VIRTUAL -> {
                    MethodRef target = ins.methodRef();
                    if (target == null) {
                        break;
                    }
                    if (!state.sawSelfCall && isSelfCall(ins, target, method, context)) {
                        log.debug("found non-public this call at {}", String.format("%04X", ins.offset()));
                        state.sawSelfCall = true;
                    }
                    // Helpers like checkIfClosedThrowDisposed or CheckObjectDisposed
                    if (!state.sawGuardHelperCall && config.isGuardHelperName(target.name())) {
                        log.debug("found dispose check at {}", String.format("%04X", ins.offset()));
                        state.sawGuardHelperCall = true;
                    }
                }
                case LOAD_FIELD, STORE_FIELD, LOAD_FIELD_ADDRESS -> {
                    FieldRef field = ins.fieldRef();
                    if (!state.sawSelfField && field != null && field.declaringType().equals(owner)
                            && tracer.isSelfReceiver(ins, method)) {
                        log.debug("found field access at {}", String.format("%04X", ins.offset()));
                        state.sawSelfField = true;
                    }
                }
                case CONSTRUCT_OBJECT -> {
                    TypeRef type = ins.typeRef();
                    if (!state.sawGuardExceptionConstruction && type != null
                            && type.fqn().equals(config.guardException())) {
                        log.debug("creates exception at {}", String.format("%04X", ins.offset()));
                        state.sawGuardExceptionConstruction = true;
                    }
                }
                default -> {
                    // nothing to record
                }
            }
        }

        log.debug("{}: {}", method, state);
        return state;
    }

    private boolean isSelfCall(Instruction ins, MethodRef target, MethodInfo method, AnalysisContext context) {
        Optional<MethodInfo> callee = context.resolver().resolve(target);
        if (callee.isEmpty()) {
            return false;
        }
        MethodInfo resolved = callee.get();
        if (resolved.isPublic() || resolved.isStatic()) {
            return false;
        }
        if (!resolved.declaringType().equals(method.declaringType())) {
            return false;
        }
        return tracer.isSelfReceiver(ins, method);
    }
}
