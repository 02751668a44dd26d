package exception;

public class CompileException extends RuntimeException {
    public CompileException(String message) {
        super(message);
    }

    public static CompileException unSupported(String msg) {
        return new CompileException("UnSupported: " + msg);
    }

    public static CompileException duplicateSymbol(String msg) {
        return new CompileException("Duplicate symbol: " + msg);
    }

    public static CompileException illegalOperand(String msg) {
        return new CompileException("Illegal operand: " + msg);
    }

    public static CompileException illegalInstruction(String msg) {
        return new CompileException("Illegal instruction: " + msg);
    }
}
