package com.ethnicthv.flux.processor;

import com.google.auto.service.AutoService;

import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.NestingKind;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generates compile-time converter registrations for classes annotated with
 * {@code @ValueConverter}.
 * <p>
 * For every package holding annotated converters a {@code GeneratedConverterIndex} is written
 * that implements {@code ConverterIndex} with one {@code registry.register(source, target, type)}
 * call per converter, the pair being read from the class' {@code IValueConverter<S, D>}
 * type arguments. When processing is over all generated indices are listed in
 * {@code META-INF/services/com.ethnicthv.flux.core.convert.ConverterIndex}.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes(ConverterIndexProcessor.ANNO_VALUE_CONVERTER)
public class ConverterIndexProcessor extends BaseProcessor {
    // ---------------------------------------------------------------------
    // Constants
    // ---------------------------------------------------------------------
    static final String ANNO_VALUE_CONVERTER = "com.ethnicthv.flux.core.convert.ValueConverter";
    static final String CONVERTER_IFACE = "com.ethnicthv.flux.core.convert.IValueConverter";
    static final String INDEX_IFACE = "com.ethnicthv.flux.core.convert.ConverterIndex";
    static final String REGISTRY_CLASS = "com.ethnicthv.flux.core.convert.ConverterRegistry";
    static final String INDEX_SIMPLE_NAME = "GeneratedConverterIndex";
    static final String SERVICE_FILE = "META-INF/services/" + INDEX_IFACE;

    // package -> converters waiting for their index
    private final Map<String, List<ConverterEntry>> pendingByPackage = new LinkedHashMap<>();
    private final Set<String> generatedIndices = new LinkedHashSet<>();
    private boolean serviceFileWritten;

    record ConverterEntry(String converterType, String sourceType, String targetType, TypeElement element) {}

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        TypeElement annotation = getTypeElement(ANNO_VALUE_CONVERTER);
        if (annotation != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(annotation)) {
                ConverterEntry entry = readConverter(e);
                if (entry != null) {
                    pendingByPackage.computeIfAbsent(packageOf(entry.element()), p -> new ArrayList<>()).add(entry);
                }
            }
        }

        for (Map.Entry<String, List<ConverterEntry>> pkg : pendingByPackage.entrySet()) {
            try {
                generateIndex(pkg.getKey(), pkg.getValue());
            } catch (IOException ex) {
                error("Failed to generate converter index for package %s: %s", pkg.getKey(), ex.getMessage());
            }
        }
        pendingByPackage.clear();

        if (roundEnv.processingOver() && !generatedIndices.isEmpty() && !serviceFileWritten) {
            try {
                writeServiceFile();
            } catch (IOException ex) {
                error("Failed to write %s: %s", SERVICE_FILE, ex.getMessage());
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Validation & type argument extraction
    // ---------------------------------------------------------------------
    private ConverterEntry readConverter(Element e) {
        if (e.getKind() != ElementKind.CLASS) {
            error(e, "@ValueConverter is only allowed on classes");
            return null;
        }
        TypeElement type = (TypeElement) e;
        Set<Modifier> modifiers = type.getModifiers();
        if (!modifiers.contains(Modifier.PUBLIC) || modifiers.contains(Modifier.ABSTRACT)) {
            error(e, "@ValueConverter class %s must be public and concrete", type.getQualifiedName());
            return null;
        }
        if (type.getNestingKind() == NestingKind.MEMBER && !modifiers.contains(Modifier.STATIC)) {
            error(e, "@ValueConverter class %s must be a top level or static nested class", type.getQualifiedName());
            return null;
        }
        if (!hasPublicNoArgConstructor(type)) {
            error(e, "@ValueConverter class %s needs a public no-arg constructor", type.getQualifiedName());
            return null;
        }
        DeclaredType converterSuper = findConverterSupertype(type.asType());
        if (converterSuper == null) {
            error(e, "@ValueConverter class %s does not implement %s", type.getQualifiedName(), CONVERTER_IFACE);
            return null;
        }
        List<? extends TypeMirror> args = converterSuper.getTypeArguments();
        if (args.size() != 2 || !isConcrete(args.get(0)) || !isConcrete(args.get(1))) {
            error(e, "@ValueConverter class %s must bind both IValueConverter type arguments to concrete types",
                    type.getQualifiedName());
            return null;
        }
        return new ConverterEntry(
                type.getQualifiedName().toString(),
                typeUtils.erasure(args.get(0)).toString(),
                typeUtils.erasure(args.get(1)).toString(),
                type);
    }

    private boolean hasPublicNoArgConstructor(TypeElement type) {
        boolean anyConstructor = false;
        for (Element member : type.getEnclosedElements()) {
            if (member.getKind() != ElementKind.CONSTRUCTOR) continue;
            anyConstructor = true;
            ExecutableElement ctor = (ExecutableElement) member;
            if (ctor.getParameters().isEmpty() && ctor.getModifiers().contains(Modifier.PUBLIC)) return true;
        }
        return !anyConstructor;
    }

    // Depth-first walk over the supertypes until IValueConverter<S, D> is reached
    private DeclaredType findConverterSupertype(TypeMirror type) {
        for (TypeMirror sup : typeUtils.directSupertypes(type)) {
            if (sup.getKind() != TypeKind.DECLARED) continue;
            DeclaredType declared = (DeclaredType) sup;
            TypeElement el = (TypeElement) declared.asElement();
            if (el.getQualifiedName().contentEquals(CONVERTER_IFACE)) return declared;
            DeclaredType found = findConverterSupertype(sup);
            if (found != null) return found;
        }
        return null;
    }

    private static boolean isConcrete(TypeMirror arg) {
        return arg.getKind() == TypeKind.DECLARED || arg.getKind() == TypeKind.ARRAY;
    }

    // ---------------------------------------------------------------------
    // Code generation
    // ---------------------------------------------------------------------
    private void generateIndex(String pkg, List<ConverterEntry> entries) throws IOException {
        String fqn = pkg.isEmpty() ? INDEX_SIMPLE_NAME : pkg + "." + INDEX_SIMPLE_NAME;
        if (generatedIndices.contains(fqn)) {
            error(entries.get(0).element(), "Converter index %s was already generated in an earlier round", fqn);
            return;
        }
        Element[] origins = entries.stream().map(ConverterEntry::element).toArray(Element[]::new);
        JavaFileObject file = processingEnv.getFiler().createSourceFile(fqn, origins);
        try (Writer w = file.openWriter()) {
            if (!pkg.isEmpty()) {
                w.write("package " + pkg + ";\n\n");
            }
            w.write("@SuppressWarnings(\"all\")\n");
            w.write("public final class " + INDEX_SIMPLE_NAME + " implements " + INDEX_IFACE + " {\n");
            w.write("    public " + INDEX_SIMPLE_NAME + "() {}\n\n");
            w.write("    @Override\n");
            w.write("    public void registerAll(" + REGISTRY_CLASS + " registry) {\n");
            for (ConverterEntry entry : entries) {
                w.write("        registry.register(" + entry.sourceType() + ".class, "
                        + entry.targetType() + ".class, " + entry.converterType() + ".class);\n");
            }
            w.write("    }\n");
            w.write("}\n");
        }
        generatedIndices.add(fqn);
        note("Generated %s with %d converters", fqn, entries.size());
    }

    private void writeServiceFile() throws IOException {
        FileObject file = processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", SERVICE_FILE);
        try (Writer w = file.openWriter()) {
            for (String fqn : generatedIndices) {
                w.write(fqn);
                w.write("\n");
            }
        }
        serviceFileWritten = true;
    }
}
