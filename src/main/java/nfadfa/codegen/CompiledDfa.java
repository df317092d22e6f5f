package nfadfa.codegen;

import java.util.Map;
import nfadfa.graph.Dfa;
import org.objectweb.asm.ClassWriter;
import org.objectweb.asm.Opcodes;

/**
 * Code generator for classes implementing {@link SymbolAcceptor} for a DFA.
 */
public final class CompiledDfa {

  private CompiledDfa() { }

  /**
   * Generate a class whose {@code accepts} method runs the DFA.
   *
   * @param dfa deterministic automaton
   * @param symbolIds interned id of every symbol in the DFA alphabet
   * @param className internal name of the class to generate
   * @param classFlags class flags to set (visibility, `final`, `synthetic` etc.)
   * @param printDebugInfo generate code which prints a trace to STDERR
   * @return class writer containing the finished class
   */
  public static ClassWriter generateAcceptorClass(
    Dfa dfa,
    Map<String, Integer> symbolIds,
    String className,
    int classFlags,
    boolean printDebugInfo
  ) {

    // Note: `COMPUTE_FRAMES` means that `visitMaxs` ignores its arguments
    final var cw = new ClassWriter(ClassWriter.COMPUTE_FRAMES);
    cw.visit(
      Opcodes.V17,
      Opcodes.ACC_SUPER | classFlags,
      className,
      null, // signature
      Method.OBJECT_CLASS_NAME,
      new String[] { Method.SYMBOLACCEPTOR_CLASS_NAME }
    );

    // Constructor (takes no arguments - the class has no state)
    {
      final var mv = Method.EMPTYINIT_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 0);
      Method.EMPTYINIT_M.invokeMethod(mv, Method.OBJECT_CLASS_NAME);
      mv.visitInsn(Opcodes.RETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `acceptsStatic` static helper method
    {
      final var mv = Method.ACCEPTSSTATIC_M.newMethod(cw, Opcodes.ACC_PRIVATE);
      mv.visitCode();
      new DfaMethodCodegen(mv, dfa, symbolIds, printDebugInfo).visitDfa();
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    // `accepts` method (just calls out to `acceptsStatic`)
    {
      final var mv = Method.ACCEPTS_M.newMethod(cw, Opcodes.ACC_PUBLIC);
      mv.visitCode();
      mv.visitVarInsn(Opcodes.ALOAD, 1);
      Method.ACCEPTSSTATIC_M.invokeMethod(mv, className);
      mv.visitInsn(Opcodes.IRETURN);
      mv.visitMaxs(0, 0);
      mv.visitEnd();
    }

    cw.visitEnd();
    return cw;
  }
}
