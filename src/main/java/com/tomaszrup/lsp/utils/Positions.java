////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
package com.tomaszrup.lsp.utils;

import java.util.Comparator;

import org.eclipse.lsp4j.Position;

/**
 * Conversions between zero-based line/character positions and absolute
 * string offsets, driven by a precomputed table of line start offsets.
 */
public class Positions {
	private Positions() {
	}

	public static final Comparator<Position> COMPARATOR = (Position p1, Position p2) -> {
		if (p1.getLine() != p2.getLine()) {
			return p1.getLine() - p2.getLine();
		}
		return p1.getCharacter() - p2.getCharacter();
	};

	public static boolean valid(Position p) {
		return p.getLine() >= 0 && p.getCharacter() >= 0;
	}

	/**
	 * Offsets at which each line of {@code text} starts. Lines end at
	 * {@code \n}, {@code \r\n} or a lone {@code \r}.
	 */
	public static int[] lineStartOffsets(String text) {
		int count = 1;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
				count++;
			}
		}
		int[] starts = new int[count];
		int line = 1;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
				starts[line++] = i + 1;
			}
		}
		return starts;
	}

	/**
	 * @param offset clamped to {@code [0, textLength]}
	 */
	public static Position positionAt(int[] lineStarts, int textLength, int offset) {
		int clamped = Math.max(0, Math.min(offset, textLength));
		int low = 0;
		int high = lineStarts.length - 1;
		while (low < high) {
			int mid = (low + high + 1) >>> 1;
			if (lineStarts[mid] <= clamped) {
				low = mid;
			} else {
				high = mid - 1;
			}
		}
		return new Position(low, clamped - lineStarts[low]);
	}

	/**
	 * A character past the end of its line is clamped to the start of the next
	 * line; a line past the end of the text maps to the text length.
	 *
	 * @return the offset, or -1 for an invalid position
	 */
	public static int offsetAt(int[] lineStarts, int textLength, Position position) {
		if (position == null || !valid(position)) {
			return -1;
		}
		if (position.getLine() >= lineStarts.length) {
			return textLength;
		}
		int lineStart = lineStarts[position.getLine()];
		int nextLineStart = position.getLine() + 1 < lineStarts.length
				? lineStarts[position.getLine() + 1]
				: textLength;
		return Math.min(lineStart + position.getCharacter(), nextLineStart);
	}
}
