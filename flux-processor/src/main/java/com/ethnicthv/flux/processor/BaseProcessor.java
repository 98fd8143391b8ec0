package com.ethnicthv.flux.processor;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.Locale;

/**
 * Shared base annotation processor providing messaging and element utilities.
 */
public abstract class BaseProcessor extends AbstractProcessor {
    protected Elements elementUtils;
    protected Types typeUtils;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.typeUtils = processingEnv.getTypeUtils();
    }

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    // ---------------------------------------------------------------------
    // Messaging helpers
    // ---------------------------------------------------------------------
    protected void error(Element element, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args), element);
    }

    protected void error(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args));
    }

    protected void note(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                String.format(Locale.ROOT, fmt, args));
    }

    // ---------------------------------------------------------------------
    // Element helpers
    // ---------------------------------------------------------------------
    protected TypeElement getTypeElement(String fqn) {
        return elementUtils.getTypeElement(fqn);
    }

    protected String packageOf(TypeElement type) {
        return elementUtils.getPackageOf(type).getQualifiedName().toString();
    }
}
