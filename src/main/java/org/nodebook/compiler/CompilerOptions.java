package org.nodebook.compiler;

/**
 * Per-compilation settings.
 *
 * @param strict          Abort on any error instead of skipping the affected declarations.
 * @param implicitTargets How undeclared relation targets are handled.
 */
public record CompilerOptions(boolean strict, ImplicitTargetPolicy implicitTargets) {

    public CompilerOptions {
        if (implicitTargets == null) {
            implicitTargets = ImplicitTargetPolicy.AUTO_CREATE;
        }
    }

    public static CompilerOptions strictMode() {
        return new CompilerOptions(true, ImplicitTargetPolicy.AUTO_CREATE);
    }

    public static CompilerOptions lenientMode() {
        return new CompilerOptions(false, ImplicitTargetPolicy.AUTO_CREATE);
    }

    public CompilerOptions withImplicitTargets(ImplicitTargetPolicy policy) {
        return new CompilerOptions(strict, policy);
    }
}
