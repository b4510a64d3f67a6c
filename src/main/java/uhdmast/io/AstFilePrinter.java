// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package uhdmast.io;

import java.io.OutputStream;
import java.util.List;

import uhdmast.core.AstFile;
import uhdmast.core.AstFile.Decl;
import uhdmast.core.AstFile.Expr;
import uhdmast.core.AstFile.Item;
import uhdmast.core.AstFile.Stmt;
import uhdmast.core.AstFile.Type;
import uhdmast.core.AstFile.Unit;
import uhdmast.core.Dimensions;
import uhdmast.util.MappablePrintWriter;

public class AstFilePrinter {
	private final MappablePrintWriter<AstFile.Item> out;

	public AstFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<AstFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(AstFile file) {
		for (Unit u : file.getUnits()) {
			write(u);
		}
		out.flush();
	}

	public void write(Unit unit) {
		String keyword = unit instanceof Unit.Package ? "package" : "module";
		out.print(keyword + " ", unit);
		out.print(unit.getName(), unit);
		out.println(";", unit);
		writeItems(1, unit.getItems());
		out.println("end" + keyword, unit);
	}

	private void writeItems(int indent, List<Item> items) {
		for (Item item : items) {
			writeItem(indent, item);
		}
	}

	private void writeItem(int indent, Item item) {
		if (item instanceof Decl.Variable) {
			writeVariable(indent, (Decl.Variable) item);
		} else if (item instanceof Decl.TypeDef) {
			writeTypeDef(indent, (Decl.TypeDef) item);
		} else if (item instanceof Stmt.Assign) {
			writeAssign(indent, (Stmt.Assign) item);
		} else if (item instanceof Stmt.Call) {
			writeCall(indent, (Stmt.Call) item);
		} else if (item instanceof Stmt.Block) {
			writeBlock(indent, (Stmt.Block) item);
		} else {
			throw new IllegalArgumentException("unknown item encountered (" + item.getClass().getName() + ")");
		}
	}

	private void writeVariable(int indent, Decl.Variable d) {
		Dimensions dims = d.getDimensions();
		if (dims != null) {
			out.tab(indent);
			out.print("(* packed_ranges = \"" + dims.toString(true) + "\", unpacked_ranges = \""
					+ dims.toString(false) + "\" *)", d);
			out.println();
		}
		out.tab(indent);
		switch (d.getDirection()) {
		case INPUT:
			out.print("input ", d);
			break;
		case OUTPUT:
			out.print("output ", d);
			break;
		case INOUT:
			out.print("inout ", d);
			break;
		default:
		}
		switch (d.getKind()) {
		case MEMORY:
			out.print("reg ", d);
			break;
		case PARAMETER:
			out.print("parameter ", d);
			break;
		case LOCALPARAM:
			out.print("localparam ", d);
			break;
		default:
			out.print("wire ", d);
		}
		if (dims == null && d.getTypeName() != null) {
			out.print(d.getTypeName() + " ", d);
		} else if (dims == null && d.getType() != null) {
			writeType(indent, d.getType());
			out.print(" ", d);
		}
		writeRanges(d.getPacked());
		if (!d.getPacked().isEmpty()) {
			out.print(" ", d);
		}
		out.print(d.getName(), d);
		writeRanges(d.getUnpacked());
		if (d.getInitialiser() != null) {
			out.print(" = ", d);
			writeExpression(d.getInitialiser());
		}
		out.println(";", d);
	}

	private void writeTypeDef(int indent, Decl.TypeDef d) {
		out.tab(indent);
		out.print("typedef ", d);
		writeType(indent, d.getType());
		out.print(" ", d);
		out.print(d.getName(), d);
		out.println(";", d);
	}

	private void writeType(int indent, Type t) {
		if (t instanceof Type.Vector) {
			out.print("logic", t);
			writeRanges(((Type.Vector) t).getPacked());
		} else if (t instanceof Type.Named) {
			out.print(((Type.Named) t).getName(), t);
		} else if (t instanceof Type.Record) {
			Type.Record r = (Type.Record) t;
			out.println(r.isUnion() ? "union packed {" : "struct packed {", t);
			for (Type.Field f : r.getFields()) {
				out.tab(indent + 1);
				writeType(indent + 1, f.getType());
				out.print(" ", f);
				out.print(f.getName(), f);
				if (f.getDimension() != null) {
					writeRange(f.getDimension());
				}
				out.println(";", f);
			}
			out.tab(indent);
			out.print("}", t);
		} else if (t instanceof Type.Enumeration) {
			Type.Enumeration e = (Type.Enumeration) t;
			out.print("enum ", t);
			if (e.getBase() != null) {
				out.print("logic", t);
				writeRange(e.getBase());
				out.print(" ", t);
			}
			out.print("{", t);
			List<Decl.EnumItem> items = e.getItems();
			for (int i = 0; i != items.size(); ++i) {
				if (i != 0) {
					out.print(", ", t);
				}
				out.print(items.get(i).getName(), items.get(i));
				if (items.get(i).getValue() != null) {
					out.print(" = ", items.get(i));
					writeExpression(items.get(i).getValue());
				}
			}
			out.print("}", t);
		} else {
			throw new IllegalArgumentException("unknown type encountered (" + t.getClass().getName() + ")");
		}
	}

	private void writeAssign(int indent, Stmt.Assign s) {
		out.tab(indent);
		out.print("assign ", s);
		writeExpression(s.getLeftHandSide());
		out.print(" = ", s);
		writeExpression(s.getRightHandSide());
		out.println(";", s);
	}

	private void writeCall(int indent, Stmt.Call s) {
		out.tab(indent);
		out.print(s.getName(), s);
		writeArguments(s.getArguments(), s);
		out.println(";", s);
	}

	private void writeBlock(int indent, Stmt.Block s) {
		out.tab(indent);
		out.print("begin", s);
		if (s.getName() != null) {
			out.print(" : " + s.getName(), s);
		}
		out.println();
		writeItems(indent + 1, s.getAll());
		out.tab(indent);
		out.println("end", s);
	}

	private void writeRanges(List<Expr.Range> ranges) {
		for (Expr.Range r : ranges) {
			writeRange(r);
		}
	}

	private void writeRange(Expr.Range r) {
		out.print("[", r);
		writeExpression(r.getLeft());
		if (r.getRight() != null) {
			out.print(":", r);
			writeExpression(r.getRight());
		}
		out.print("]", r);
	}

	private void writeArguments(List<Expr> arguments, Item tag) {
		out.print("(", tag);
		for (int i = 0; i != arguments.size(); ++i) {
			if (i != 0) {
				out.print(", ", tag);
			}
			writeExpression(arguments.get(i));
		}
		out.print(")", tag);
	}

	private void writeExpressionWithBraces(Expr e) {
		if (e instanceof Expr.BinaryOperator) {
			out.print("(", e);
			writeExpression(e);
			out.print(")", e);
		} else {
			writeExpression(e);
		}
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Integer) {
			writeInteger((Expr.Integer) e);
		} else if (e instanceof Expr.Real) {
			out.print(Double.toString(((Expr.Real) e).getValue()), e);
		} else if (e instanceof Expr.Str) {
			out.print("\"" + ((Expr.Str) e).getValue() + "\"", e);
		} else if (e instanceof Expr.Identifier) {
			writeIdentifier((Expr.Identifier) e);
		} else if (e instanceof Expr.Range) {
			writeRange((Expr.Range) e);
		} else if (e instanceof Expr.Addition) {
			writeInfix((Expr.BinaryOperator) e, " + ");
		} else if (e instanceof Expr.Subtraction) {
			writeInfix((Expr.BinaryOperator) e, " - ");
		} else if (e instanceof Expr.Multiplication) {
			writeInfix((Expr.BinaryOperator) e, " * ");
		} else if (e instanceof Expr.Invoke) {
			Expr.Invoke i = (Expr.Invoke) e;
			out.print(i.getName(), e);
			writeArguments(i.getArguments(), e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeInteger(Expr.Integer e) {
		switch (e.getFormat()) {
		case BINARY:
			out.print("'b" + e.getValue().toString(2), e);
			break;
		case OCTAL:
			out.print("'o" + e.getValue().toString(8), e);
			break;
		case HEX:
			out.print("'h" + e.getValue().toString(16), e);
			break;
		case DECIMAL:
			out.print("'d" + e.getValue().toString(), e);
			break;
		default:
			out.print(e.getValue().toString(), e);
		}
	}

	private void writeIdentifier(Expr.Identifier e) {
		out.print(e.getName(), e);
		for (Expr.Range r : e.getSelectors()) {
			writeRange(r);
		}
		for (Expr.Dot d = e.getDot(); d != null; d = d.getNext()) {
			out.print("." + d.getField(), d);
			writeRanges(d.getSelectors());
		}
	}

	private void writeInfix(Expr.BinaryOperator e, String operator) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(operator, (Expr) e);
		writeExpressionWithBraces(e.getRightHandSide());
	}
}
