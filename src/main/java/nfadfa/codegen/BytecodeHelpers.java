package nfadfa.codegen;

import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import org.objectweb.asm.Type;

/**
 * Superclass with utility methods for emitting compact bytecode.
 *
 * <p>Method bodies must fit in a code array whose length is an unsigned 16-bit
 * number, and every DFA state turns into a block of the same method, so it
 * pays to pick the shortest encoding of common instruction sequences.
 */
class BytecodeHelpers {

  // Field and descriptor constants associated with `System.err`
  private static final String SYSTEM_ERR = "err";
  private static final String PRINTSTREAM_DESC = Type.getDescriptor(java.io.PrintStream.class);

  /**
   * Method visitor into which code will be emitted.
   */
  protected final MethodVisitor mv;

  BytecodeHelpers(MethodVisitor mv) {
    this.mv = mv;
  }

  /**
   * Emit code to print a constant line to "standard" error.
   *
   * @param message constant message to print
   */
  protected void visitPrintErrConstantLine(String message) {
    mv.visitFieldInsn(Opcodes.GETSTATIC, Method.SYSTEM_CLASS_NAME, SYSTEM_ERR, PRINTSTREAM_DESC);
    mv.visitLdcInsn(message);
    Method.PRINTLNSTR_M.invokeMethod(mv, Method.PRINTSTREAM_CLASS_NAME);
  }

  /**
   * Emit code to print the {@code int} at the top of the stack to "standard"
   * error, leaving the stack unchanged.
   */
  protected void visitPrintErrIntPeek() {
    mv.visitInsn(Opcodes.DUP);
    mv.visitFieldInsn(Opcodes.GETSTATIC, Method.SYSTEM_CLASS_NAME, SYSTEM_ERR, PRINTSTREAM_DESC);
    mv.visitInsn(Opcodes.SWAP);
    Method.PRINTLNINT_M.invokeMethod(mv, Method.PRINTSTREAM_CLASS_NAME);
  }

  /**
   * Pop an {@code int} and jump to the label matching its value.
   *
   * <p>Equivalent to {@code mv.visitLookupSwitchInsn(dflt, values, labels)},
   * but uses a conditional jump for one value and a {@code tableswitch} when
   * the values are contiguous.
   *
   * @param dflt label to jump to if nothing else matches
   * @param values test values in the switch (sorted in ascending order)
   * @param labels labels to jump to if the scrutinee is in the test values
   */
  protected void visitLookupBranch(Label dflt, int[] values, Label[] labels) {
    if (values.length == 0) {
      mv.visitInsn(Opcodes.POP);
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
      return;
    }

    if (values.length == 1) {
      if (values[0] == 0) {
        mv.visitJumpInsn(Opcodes.IFEQ, labels[0]);
      } else {
        visitConstantInt(values[0]);
        mv.visitJumpInsn(Opcodes.IF_ICMPEQ, labels[0]);
      }
      mv.visitJumpInsn(Opcodes.GOTO, dflt);
      return;
    }

    final boolean contiguous = values[values.length - 1] - values[0] == values.length - 1;
    if (contiguous) {
      mv.visitTableSwitchInsn(values[0], values[values.length - 1], dflt, labels);
    } else {
      mv.visitLookupSwitchInsn(dflt, values, labels);
    }
  }

  /**
   * Push an integer constant onto the stack.
   *
   * <p>Equivalent to {@code mv.visitLdcInsn(constant)}, but shorter for small
   * constants and not consuming a slot in the constants table.
   *
   * @param constant integer constant
   */
  protected void visitConstantInt(int constant) {
    if (-1 <= constant && constant <= 5) {
      mv.visitInsn(Opcodes.ICONST_0 + constant);
    } else if (Byte.MIN_VALUE <= constant && constant <= Byte.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.BIPUSH, constant);
    } else if (Short.MIN_VALUE <= constant && constant <= Short.MAX_VALUE) {
      mv.visitIntInsn(Opcodes.SIPUSH, constant);
    } else {
      mv.visitLdcInsn(constant);
    }
  }
}
