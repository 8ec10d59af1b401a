package io.disposescan.bytecode;

import io.disposescan.model.ClassInfo;
import io.disposescan.model.MethodFlag;
import io.disposescan.model.MethodInfo;
import org.objectweb.asm.AnnotationVisitor;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.RecordComponentVisitor;
import org.objectweb.asm.Type;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * ClassVisitor that scans a class and builds a ClassInfo model.
 * <p>
 * With bodies enabled, each method body is decoded by an {@link InstructionDecoder}.
 * Without bodies only signatures and flags are recorded, which is all the hierarchy and
 * reference resolution need for library classes.
 */
public class ClassScanner extends ClassVisitor {

    private static final Pattern GETTER = Pattern.compile("get\\p{Lu}.*");
    private static final Pattern BOOLEAN_GETTER = Pattern.compile("is\\p{Lu}.*");
    private static final Pattern LISTENER_REGISTRATION = Pattern.compile("(add|remove)\\p{Lu}\\w*Listener");
    private static final Pattern EVENT_RAISE = Pattern.compile("fire\\p{Lu}\\w*");

    private final boolean withBodies;

    private String className;
    private String superClass;
    private final Set<String> implementedInterfaces = new HashSet<>();
    private boolean isInterface;
    private boolean isGenerated;
    private String sourceFile;
    private final Set<String> recordAccessors = new HashSet<>(); // name + descriptor
    private final Map<String, MethodInfo> methods = new LinkedHashMap<>();

    public ClassScanner() {
        this(true);
    }

    public ClassScanner(boolean withBodies) {
        super(Opcodes.ASM9);
        this.withBodies = withBodies;
    }

    @Override
    public void visit(int version, int access, String name, String signature,
                      String superName, String[] interfaces) {
        this.className = DescriptorParser.toFqn(name);
        this.isInterface = (access & Opcodes.ACC_INTERFACE) != 0;
        this.isGenerated = (access & Opcodes.ACC_SYNTHETIC) != 0;

        if (superName != null && !superName.equals("java/lang/Object")) {
            this.superClass = DescriptorParser.toFqn(superName);
        }

        if (interfaces != null) {
            Arrays.stream(interfaces)
                    .map(DescriptorParser::toFqn)
                    .forEach(implementedInterfaces::add);
        }

        super.visit(version, access, name, signature, superName, interfaces);
    }

    @Override
    public void visitSource(String source, String debug) {
        this.sourceFile = source;
        super.visitSource(source, debug);
    }

    @Override
    public AnnotationVisitor visitAnnotation(String descriptor, boolean visible) {
        if (isGeneratedAnnotation(descriptor)) {
            isGenerated = true;
        }
        return super.visitAnnotation(descriptor, visible);
    }

    @Override
    public RecordComponentVisitor visitRecordComponent(String name, String descriptor, String signature) {
        recordAccessors.add(name + "()" + descriptor);
        return super.visitRecordComponent(name, descriptor, signature);
    }

    @Override
    public MethodVisitor visitMethod(int access, String name, String descriptor,
                                     String signature, String[] exceptions) {
        Set<MethodFlag> flags = classify(access, name, descriptor);

        boolean hasBody = !flags.contains(MethodFlag.ABSTRACT) && !flags.contains(MethodFlag.NATIVE);
        if (!withBodies || !hasBody) {
            methods.put(name + descriptor, newMethod(name, descriptor, flags).build());
            return super.visitMethod(access, name, descriptor, signature, exceptions);
        }

        InstructionDecoder decoder = new InstructionDecoder(flags.contains(MethodFlag.STATIC));

        final String methodName = name;
        final String methodDescriptor = descriptor;

        return new MethodVisitor(Opcodes.ASM9, decoder) {
            @Override
            public AnnotationVisitor visitAnnotation(String annotationDescriptor, boolean visible) {
                if (isGeneratedAnnotation(annotationDescriptor)) {
                    flags.add(MethodFlag.GENERATED_CODE);
                }
                return super.visitAnnotation(annotationDescriptor, visible);
            }

            @Override
            public void visitEnd() {
                super.visitEnd();

                MethodInfo.Builder method = newMethod(methodName, methodDescriptor, flags)
                        .instructions(decoder.getInstructions())
                        .firstLine(decoder.getFirstLine());
                decoder.getHandlerOffsets().forEach(method::handlerOffset);
                methods.put(methodName + methodDescriptor, method.build());
            }
        };
    }

    private MethodInfo.Builder newMethod(String name, String descriptor, Set<MethodFlag> flags) {
        return MethodInfo.builder()
                .declaringType(className)
                .name(name)
                .descriptor(descriptor)
                .flags(flags)
                .sourceFile(sourceFile);
    }

    private Set<MethodFlag> classify(int access, String name, String descriptor) {
        Set<MethodFlag> flags = EnumSet.noneOf(MethodFlag.class);
        if ((access & Opcodes.ACC_PUBLIC) != 0) {
            flags.add(MethodFlag.PUBLIC);
        }
        boolean isStatic = (access & Opcodes.ACC_STATIC) != 0;
        if (isStatic) {
            flags.add(MethodFlag.STATIC);
        }
        if ((access & Opcodes.ACC_ABSTRACT) != 0) {
            flags.add(MethodFlag.ABSTRACT);
        }
        if ((access & Opcodes.ACC_NATIVE) != 0) {
            flags.add(MethodFlag.NATIVE);
        }
        if ((access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0 || isGenerated) {
            flags.add(MethodFlag.GENERATED_CODE);
        }
        if (name.equals("<init>") || name.equals("<clinit>")) {
            flags.add(MethodFlag.CONSTRUCTOR);
        }
        if (name.equals("finalize") && descriptor.equals("()V")) {
            flags.add(MethodFlag.FINALIZER);
        }

        Type methodType = Type.getMethodType(descriptor);
        int parameterCount = methodType.getArgumentTypes().length;
        Type returnType = methodType.getReturnType();

        if (!isStatic && parameterCount == 0) {
            boolean beanGetter = GETTER.matcher(name).matches() && returnType.getSort() != Type.VOID;
            boolean booleanGetter = BOOLEAN_GETTER.matcher(name).matches() && returnType.getSort() == Type.BOOLEAN;
            if (beanGetter || booleanGetter || recordAccessors.contains(name + descriptor)) {
                flags.add(MethodFlag.PROPERTY_GETTER);
            }
        }
        if (!isStatic && parameterCount == 1 && returnType.getSort() == Type.VOID
                && LISTENER_REGISTRATION.matcher(name).matches()) {
            flags.add(MethodFlag.EVENT_ACCESSOR);
        }
        if (!isStatic && EVENT_RAISE.matcher(name).matches()) {
            flags.add(MethodFlag.EVENT_ACCESSOR);
        }
        return flags;
    }

    private static boolean isGeneratedAnnotation(String descriptor) {
        String fqn = DescriptorParser.parseFieldType(descriptor);
        return fqn != null && "Generated".equals(DescriptorParser.simpleName(fqn));
    }

    /**
     * Builds and returns the ClassInfo for this scanned class.
     *
     * @return The ClassInfo, or null if no class was visited
     */
    public ClassInfo buildClassInfo() {
        if (className == null) {
            return null;
        }
        return new ClassInfo(
                className,
                superClass,
                implementedInterfaces,
                isInterface,
                isGenerated,
                sourceFile,
                methods
        );
    }
}
