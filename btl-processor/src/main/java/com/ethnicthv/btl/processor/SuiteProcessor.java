package com.ethnicthv.btl.processor;

import com.google.auto.service.AutoService;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.lang.model.util.ElementFilter;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Annotation processor that collects every {@code @DescribeClass} suite and generates
 * the central registry com.ethnicthv.btl.generated.GeneratedSuites with
 * registerAll(SuiteRegistry), which {@code BTL.Builder} invokes at startup.
 * <p>
 * Suites are registered sorted by their qualified name so the generated order, and thus
 * the run order, does not depend on the order javac hands elements over.
 */
@SupportedAnnotationTypes({
        "com.ethnicthv.btl.core.suite.annotation.DescribeClass",
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
@AutoService(Processor.class)
public class SuiteProcessor extends BaseProcessor {
    // ---------------------------------------------------------------------
    // Constants
    // ---------------------------------------------------------------------
    private static final String ANNO_DESCRIBE = "com.ethnicthv.btl.core.suite.annotation.DescribeClass";
    private static final String TEST_SUITE = "com.ethnicthv.btl.core.suite.TestSuite";
    private static final String GENERATED_PKG = "com.ethnicthv.btl.generated";
    private static final String GENERATED_NAME = "GeneratedSuites";

    // suite FQN -> subject FQN, accumulated across rounds
    private final Map<String, String> collectedSuites = new TreeMap<>();
    private boolean generated;

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------
    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        note("SuiteProcessor init");
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        TypeElement describeAnno = getTypeElement(ANNO_DESCRIBE);
        TypeElement suiteType = getTypeElement(TEST_SUITE);
        if (describeAnno != null && suiteType != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(describeAnno)) {
                collect(e, suiteType);
            }
        }
        if (roundEnv.processingOver() && !collectedSuites.isEmpty() && !generated) {
            try {
                generateCentralRegistry();
                generated = true;
            } catch (IOException ex) {
                error("Failed to generate central suite registry: %s", ex.getMessage());
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------------
    private void collect(Element e, TypeElement suiteType) {
        if (e.getKind() != ElementKind.CLASS) {
            error(e, "@DescribeClass is only allowed on classes extending %s", TEST_SUITE);
            return;
        }
        TypeElement suite = (TypeElement) e;
        Set<Modifier> mods = suite.getModifiers();
        if (!mods.contains(Modifier.PUBLIC) || mods.contains(Modifier.ABSTRACT)) {
            error(e, "Suite %s must be public and not abstract", suite.getQualifiedName());
            return;
        }
        if (suite.getNestingKind() == NestingKind.MEMBER && !mods.contains(Modifier.STATIC)) {
            error(e, "Nested suite %s must be static", suite.getQualifiedName());
            return;
        }
        if (suite.getNestingKind() == NestingKind.LOCAL || suite.getNestingKind() == NestingKind.ANONYMOUS) {
            error(e, "Suite %s must be a top-level or static nested class", suite.getQualifiedName());
            return;
        }
        if (!hasPublicNoArgConstructor(suite)) {
            error(e, "Suite %s needs a public no-argument constructor", suite.getQualifiedName());
            return;
        }

        AnnotationMirror am = getAnnotation(e, ANNO_DESCRIBE);
        TypeMirror subject = readTypeMirror(am, "value");
        if (subject == null || subject.getKind() != TypeKind.DECLARED) {
            error(e, "@DescribeClass on %s must name a class or interface type", suite.getQualifiedName());
            return;
        }

        TypeMirror declaredSubject = findSuiteTypeArgument(suite, suiteType);
        if (declaredSubject == null) {
            error(e, "%s is annotated with @DescribeClass but does not extend %s", suite.getQualifiedName(), TEST_SUITE);
            return;
        }
        if (declaredSubject.getKind() == TypeKind.DECLARED
                && !typeUtils.isSameType(typeUtils.erasure(declaredSubject), typeUtils.erasure(subject))) {
            error(e, "%s extends TestSuite<%s> but @DescribeClass names %s",
                    suite.getQualifiedName(), declaredSubject, typeUtils.erasure(subject));
            return;
        }

        String subjectFqn = typeUtils.erasure(subject).toString();
        collectedSuites.put(suite.getQualifiedName().toString(), subjectFqn);
        note("Collected suite %s for subject %s", suite.getQualifiedName(), subjectFqn);
    }

    private boolean hasPublicNoArgConstructor(TypeElement type) {
        List<ExecutableElement> ctors = ElementFilter.constructorsIn(type.getEnclosedElements());
        for (ExecutableElement c : ctors) {
            if (c.getParameters().isEmpty() && c.getModifiers().contains(Modifier.PUBLIC)) return true;
        }
        return false;
    }

    /** Type argument of the TestSuite supertype, or null when TestSuite is not a superclass. */
    private TypeMirror findSuiteTypeArgument(TypeElement type, TypeElement suiteType) {
        TypeMirror current = type.getSuperclass();
        while (current.getKind() == TypeKind.DECLARED) {
            DeclaredType dt = (DeclaredType) current;
            TypeElement el = (TypeElement) dt.asElement();
            if (el.getQualifiedName().contentEquals(suiteType.getQualifiedName())) {
                List<? extends TypeMirror> args = dt.getTypeArguments();
                return args.isEmpty() ? typeUtils.getNoType(TypeKind.NONE) : args.get(0);
            }
            current = el.getSuperclass();
        }
        return null;
    }

    // ---------------------------------------------------------------------
    // Generation
    // ---------------------------------------------------------------------
    private void generateCentralRegistry() throws IOException {
        String fqn = GENERATED_PKG + "." + GENERATED_NAME;
        JavaFileObject file = processingEnv.getFiler().createSourceFile(fqn);
        try (Writer w = file.openWriter()) {
            w.write("package " + GENERATED_PKG + ";\n\n");
            w.write("@SuppressWarnings(\"all\")\n");
            w.write("public final class " + GENERATED_NAME + " {\n");
            w.write("    private " + GENERATED_NAME + "() {}\n\n");
            w.write("    public static void registerAll(com.ethnicthv.btl.core.suite.SuiteRegistry registry) {\n");
            for (Map.Entry<String, String> entry : collectedSuites.entrySet()) {
                w.write("        registry.register(" + entry.getValue() + ".class, " + entry.getKey() + "::new);\n");
            }
            w.write("    }\n");
            w.write("}\n");
        }
        note("Generated %s with %d suites", fqn, collectedSuites.size());
    }
}
