package io.github.cyfko.depman.processor;

import com.google.auto.service.AutoService;
import io.github.cyfko.depman.Implements;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Annotation processor responsible for generating the registration index of
 * {@link Implements} classes.
 * <p>
 * The processor validates:
 * <ul>
 *     <li>that @Implements is used only on concrete, public, top-level or static nested classes</li>
 *     <li>that every enclosing class of a nested class is public</li>
 *     <li>that the class has a public no-argument constructor without checked exceptions</li>
 *     <li>that the class is assignable to its declared contract</li>
 *     <li>that each contract is implemented by a single class</li>
 * </ul>
 * At the end of processing, a class named
 * {@code io.github.cyfko.depman.providers.RegistrationProviderImpl}
 * is generated, listing one registration per class with a constructor
 * reference as factory.
 * <p>
 * Compilation will fail if any validation errors are detected.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.cyfko.depman.Implements")
public final class DependencyIndexProcessor extends AbstractProcessor {

    private static final String GENERATED_PACKAGE = "io.github.cyfko.depman.providers";
    private static final String GENERATED_CLASS = "RegistrationProviderImpl";

    /**
     * Keyed by the contract's qualified name, in discovery order.
     */
    private final Map<String, ImplementationInfo> entries = new LinkedHashMap<>();
    private boolean hasErrors = false;

    private static class ImplementationInfo {
        final String contractName;
        final String implementationName;
        final boolean constructEagerly;
        final boolean singleInstance;
        final Element element;

        ImplementationInfo(String contractName, String implementationName,
                           boolean constructEagerly, boolean singleInstance, Element element) {
            this.contractName = contractName;
            this.implementationName = implementationName;
            this.constructEagerly = constructEagerly;
            this.singleInstance = singleInstance;
            this.element = element;
        }
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment env) {
        Messager log = processingEnv.getMessager();

        Set<? extends Element> annotatedElements = env.getElementsAnnotatedWith(Implements.class);

        if (!annotatedElements.isEmpty()) {
            log.printMessage(Diagnostic.Kind.NOTE, "Processing @Implements...");
        }

        for (Element element : annotatedElements) {

            if (element.getKind() != ElementKind.CLASS) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "@Implements can only be applied to classes", element);
                hasErrors = true;
                continue;
            }

            TypeElement type = (TypeElement) element;

            if (!isInstantiable(type, log)) {
                hasErrors = true;
                continue;
            }

            TypeMirror contract = contractOf(type);
            if (contract == null || contract.getKind() != TypeKind.DECLARED) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "@Implements contract of " + type.getQualifiedName()
                                + " must be a class or interface", element);
                hasErrors = true;
                continue;
            }

            Types types = processingEnv.getTypeUtils();
            TypeElement contractElement = (TypeElement) ((DeclaredType) contract).asElement();
            String contractName = contractElement.getQualifiedName().toString();

            if (!types.isAssignable(types.erasure(type.asType()), types.erasure(contract))) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "The class " + type.getQualifiedName() + " does not implement " + contractName + ".",
                        element);
                hasErrors = true;
                continue;
            }

            if (entries.containsKey(contractName)) {
                ImplementationInfo existing = entries.get(contractName);
                String msg = "Duplicate @Implements contract '" + contractName + "' found on "
                        + type.getQualifiedName() + ". Already implemented by "
                        + existing.implementationName;
                log.printMessage(Diagnostic.Kind.ERROR, msg, element);

                log.printMessage(Diagnostic.Kind.ERROR,
                        "First usage of @Implements(" + contractName + ".class)",
                        existing.element);

                hasErrors = true;
                continue;
            }

            Implements annotation = type.getAnnotation(Implements.class);
            entries.put(contractName, new ImplementationInfo(
                    contractName,
                    type.getQualifiedName().toString(),
                    annotation.constructEagerly(),
                    annotation.singleInstance(),
                    element
            ));
        }

        if (env.processingOver()) {
            if (hasErrors) {
                log.printMessage(
                        Diagnostic.Kind.ERROR,
                        "Cannot generate registration index due to @Implements validation errors. " +
                                "Fix the errors above and recompile."
                );
            } else {
                writeProvider();
            }
        }

        return true;
    }

    /**
     * Checks that the generated code can call {@code new Type()}.
     */
    private boolean isInstantiable(TypeElement type, Messager log) {
        Set<Modifier> modifiers = type.getModifiers();

        if (modifiers.contains(Modifier.ABSTRACT)) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@Implements class " + type.getQualifiedName() + " must not be abstract", type);
            return false;
        }

        if (!modifiers.contains(Modifier.PUBLIC)) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@Implements class " + type.getQualifiedName() + " must be public", type);
            return false;
        }

        if (type.getNestingKind() == NestingKind.MEMBER && !modifiers.contains(Modifier.STATIC)) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@Implements class " + type.getQualifiedName() + " must be static when nested", type);
            return false;
        }

        for (Element outer = type.getEnclosingElement();
             outer instanceof TypeElement;
             outer = outer.getEnclosingElement()) {
            if (!outer.getModifiers().contains(Modifier.PUBLIC)) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "@Implements class " + type.getQualifiedName() + " must be accessible: enclosing class "
                                + ((TypeElement) outer).getQualifiedName() + " is not public", type);
                return false;
            }
        }

        Optional<ExecutableElement> noArgConstructor = ElementFilter.constructorsIn(type.getEnclosedElements())
                .stream()
                .filter(c -> c.getParameters().isEmpty() && c.getModifiers().contains(Modifier.PUBLIC))
                .findFirst();

        if (noArgConstructor.isEmpty()) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "@Implements class " + type.getQualifiedName()
                            + " must declare a public no-argument constructor", type);
            return false;
        }

        // The generated factory is a Supplier, which cannot throw checked exceptions.
        for (TypeMirror thrown : noArgConstructor.get().getThrownTypes()) {
            if (isChecked(thrown)) {
                log.printMessage(Diagnostic.Kind.ERROR,
                        "@Implements class " + type.getQualifiedName()
                                + " must have a no-argument constructor that throws no checked exception, found "
                                + thrown, noArgConstructor.get());
                return false;
            }
        }

        return true;
    }

    private boolean isChecked(TypeMirror thrown) {
        Types types = processingEnv.getTypeUtils();
        TypeMirror runtimeException = processingEnv.getElementUtils()
                .getTypeElement(RuntimeException.class.getCanonicalName()).asType();
        TypeMirror error = processingEnv.getElementUtils()
                .getTypeElement(Error.class.getCanonicalName()).asType();
        return !types.isAssignable(thrown, runtimeException) && !types.isAssignable(thrown, error);
    }

    /**
     * Reads {@link Implements#value()} as a type mirror; the {@code Class}
     * itself is not available during compilation.
     */
    private TypeMirror contractOf(TypeElement type) {
        String annotationName = Implements.class.getCanonicalName();

        for (AnnotationMirror mirror : type.getAnnotationMirrors()) {
            TypeElement annotationType = (TypeElement) mirror.getAnnotationType().asElement();
            if (!annotationType.getQualifiedName().contentEquals(annotationName)) {
                continue;
            }

            for (var value : mirror.getElementValues().entrySet()) {
                if (value.getKey().getSimpleName().contentEquals("value")
                        && value.getValue().getValue() instanceof TypeMirror) {
                    return (TypeMirror) value.getValue().getValue();
                }
            }
        }
        return null;
    }

    private void writeProvider() {
        Messager log = processingEnv.getMessager();

        try {
            JavaFileObject file = processingEnv.getFiler()
                    .createSourceFile(GENERATED_PACKAGE + "." + GENERATED_CLASS);

            try (Writer writer = file.openWriter()) {
                writeProviderClass(writer);
            }

            log.printMessage(Diagnostic.Kind.NOTE,
                    "Generated " + GENERATED_CLASS + " with " + entries.size() + " entries");

        } catch (IOException e) {
            log.printMessage(Diagnostic.Kind.ERROR,
                    "Failed to generate registration index: " + e.getMessage());
        }
    }

    private void writeProviderClass(Writer out) throws IOException {
        out.write("""
                package io.github.cyfko.depman.providers;

                import io.github.cyfko.depman.model.Registration;
                import java.util.List;
                import javax.annotation.processing.Generated;

                @Generated("io.github.cyfko.depman.processor.DependencyIndexProcessor")
                public final class RegistrationProviderImpl implements RegistrationProvider {

                    private static final List<Registration<?>> REGISTRATIONS = List.of(
                """);

        int i = 0;
        int last = entries.size() - 1;

        for (ImplementationInfo info : entries.values()) {
            out.write("        Registration.of("
                    + info.contractName + ".class, "
                    + info.implementationName + ".class, "
                    + info.implementationName + "::new, "
                    + info.constructEagerly + ", "
                    + info.singleInstance + ")");
            if (i++ != last) {
                out.write(",");
            }
            out.write("\n");
        }

        out.write("""
                    );

                    public RegistrationProviderImpl() {
                    }

                    @Override
                    public List<Registration<?>> getRegistrations() {
                        return REGISTRATIONS;
                    }
                }
                """);
    }
}
