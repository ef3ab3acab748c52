package ca.gc.cra.waymark.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Source location where a {@link Setting} was constructed. Diagnostic only; resolution never consults it.
 *
 * @param className declaring class
 * @param methodName declaring method ({@code <clinit>} for static field initializers)
 * @param fileName source file, may be {@code null} when the class was compiled without debug info
 * @param lineNumber source line, or a negative value when unknown
 * @since 0.1.0
 */
public record DeclarationSite(String className, String methodName, String fileName, int lineNumber) {
  private static final Set<String> INTERNAL_FRAMES = Set.of(
      DeclarationSite.class.getName(),
      Setting.class.getName(),
      Setting.Builder.class.getName(),
      "ca.gc.cra.waymark.application.SettingSlot",
      "ca.gc.cra.waymark.config.Waymark");

  public DeclarationSite {
    Objects.requireNonNull(className, "className");
    Objects.requireNonNull(methodName, "methodName");
  }

  /**
   * Returns the first caller frame outside the settings API, with its declaring class retained.
   *
   * @return caller frame, or empty when the stack holds only internal frames
   */
  static Optional<StackWalker.StackFrame> callerFrame() {
    return StackWalker.getInstance(StackWalker.Option.RETAIN_CLASS_REFERENCE).walk(frames -> frames
        .filter(frame -> !INTERNAL_FRAMES.contains(frame.getClassName()))
        .findFirst());
  }

  static DeclarationSite of(StackWalker.StackFrame frame) {
    return new DeclarationSite(
        frame.getClassName(), frame.getMethodName(), frame.getFileName(), frame.getLineNumber());
  }

  @Override
  public String toString() {
    String location = fileName == null ? "Unknown Source" : fileName + (lineNumber >= 0 ? ":" + lineNumber : "");
    return className + "." + methodName + "(" + location + ")";
  }
}
