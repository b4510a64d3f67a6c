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
package uhdmast.util;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which remembers which tag produced each span of output text.
 * This allows a position in the printed design to be traced back to the tree
 * node it was printed from.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private static final String INDENT = "  ";

	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int index;

	public MappablePrintWriter(OutputStream os) {
		this(new OutputStreamWriter(os, StandardCharsets.UTF_8));
	}

	public MappablePrintWriter(Writer writer) {
		this.out = writer instanceof PrintWriter ? (PrintWriter) writer : new PrintWriter(writer);
		this.mapping = new Mapping<>();
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string associated with a given tag.
	 *
	 * @param text
	 * @param tag
	 */
	public void print(String text, T tag) {
		out.print(text);
		if (!text.isEmpty()) {
			mapping.put(tag, index, text.length());
		}
		index += text.length();
	}

	/**
	 * Print a newline.
	 */
	public void println() {
		out.println();
		mapping.newLine();
		index = 0;
	}

	/**
	 * Print a string associated with a given tag, followed by a newline.
	 *
	 * @param text
	 * @param tag
	 */
	public void println(String text, T tag) {
		print(text, tag);
		println();
	}

	/**
	 * Print a given level of indentation.
	 *
	 * @param n
	 */
	public void tab(int n) {
		for (int i = 0; i != n; ++i) {
			out.print(INDENT);
			index += INDENT.length();
		}
	}

	public void flush() {
		out.flush();
	}

	public void close() {
		out.close();
	}

	public static class Mapping<T> {
		private final ArrayList<ArrayList<Span<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T tag, int start, int length) {
			int end = (start + length) - 1;
			lines.get(lines.size() - 1).add(new Span<>(tag, start, end));
		}

		public void newLine() {
			lines.add(new ArrayList<>());
		}

		/**
		 * Get the number of lines printed so far, including the current one.
		 *
		 * @return
		 */
		public int size() {
			return lines.size();
		}

		/**
		 * Get the tag printed at a given position, or <code>null</code> if there is
		 * none. Lines are numbered from 1, columns from 0.
		 *
		 * @param line
		 * @param col
		 * @return
		 */
		public T get(int line, int col) {
			line = line - 1;
			if (line < 0 || line >= lines.size()) {
				return null;
			}
			List<Span<T>> l = lines.get(line);
			for (int i = 0; i != l.size(); ++i) {
				Span<T> s = l.get(i);
				if (s.contains(col)) {
					return s.getTag();
				}
			}
			return null;
		}
	}

	/**
	 * Represents a given region of text.
	 */
	public static class Span<T> {
		private final T tag;
		private final int start;
		private final int end;

		public Span(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}

		public T getTag() {
			return tag;
		}

		public boolean contains(int col) {
			return start <= col && col <= end;
		}
	}
}
