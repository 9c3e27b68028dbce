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

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

public class Ranges {
	private Ranges() {
	}

	public static boolean contains(Range range, Position position) {
		return Positions.COMPARATOR.compare(position, range.getStart()) >= 0
				&& Positions.COMPARATOR.compare(position, range.getEnd()) <= 0;
	}

	public static boolean contains(Range outer, Range inner) {
		return contains(outer, inner.getStart()) && contains(outer, inner.getEnd());
	}
}
