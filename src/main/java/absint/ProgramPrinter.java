package absint;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a statement tree as indented, source-like lines. Used for the
 * program listing logged before an analysis.
 */
public final class ProgramPrinter implements Stmt.Visitor<Void, String> {

	private static final String INDENT = "\t";

	private final List<String> lines = new ArrayList<>();

	private ProgramPrinter() {
	}

	public static List<String> print(Stmt s) {
		ProgramPrinter p = new ProgramPrinter();
		s.accept(p, "");
		return p.lines;
	}

	@Override
	public Void visitRead(Stmt.Read s, String indent) {
		lines.add(indent + "read " + s.var);
		return null;
	}

	@Override
	public Void visitWrite(Stmt.Write s, String indent) {
		lines.add(indent + "write " + s.expr);
		return null;
	}

	@Override
	public Void visitAssign(Stmt.Assign s, String indent) {
		lines.add(indent + s.var + " := " + s.expr);
		return null;
	}

	@Override
	public Void visitIf(Stmt.If s, String indent) {
		lines.add(indent + "if " + s.cond);
		s.thenBranch.accept(this, indent + INDENT);
		lines.add(indent + "else");
		s.elseBranch.accept(this, indent + INDENT);
		return null;
	}

	@Override
	public Void visitWhile(Stmt.While s, String indent) {
		lines.add(indent + "while " + s.cond);
		s.body.accept(this, indent + INDENT);
		return null;
	}

	@Override
	public Void visitSeq(Stmt.Seq s, String indent) {
		s.first.accept(this, indent);
		s.second.accept(this, indent);
		return null;
	}
}
