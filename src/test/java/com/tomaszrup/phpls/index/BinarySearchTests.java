////////////////////////////////////////////////////////////////////////////////
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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.index;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link BinarySearch}.
 */
class BinarySearchTests {

	private final List<Integer> list = new ArrayList<>(Arrays.asList(1, 3, 3, 5, 8));
	private final BinarySearch<Integer> search = new BinarySearch<>(list);

	@Test
	void testFindPresent() {
		Assertions.assertEquals(5, search.find(n -> n.compareTo(5)));
	}

	@Test
	void testFindAbsent() {
		Assertions.assertNull(search.find(n -> n.compareTo(4)));
		Assertions.assertNull(search.find(n -> n.compareTo(9)));
	}

	@Test
	void testRankIsLowerBound() {
		Assertions.assertEquals(1, search.rank(n -> n.compareTo(3)));
		Assertions.assertEquals(3, search.rank(n -> n.compareTo(4)));
		Assertions.assertEquals(0, search.rank(n -> n.compareTo(0)));
		Assertions.assertEquals(5, search.rank(n -> n.compareTo(100)));
	}

	@Test
	void testRankOnEmptyList() {
		BinarySearch<Integer> empty = new BinarySearch<>(new ArrayList<>());
		Assertions.assertEquals(0, empty.rank(n -> n.compareTo(1)));
		Assertions.assertNull(empty.find(n -> n.compareTo(1)));
	}

	@Test
	void testRange() {
		List<Integer> range = search.range(n -> n.compareTo(3), n -> n < 6 ? -1 : 1);
		Assertions.assertEquals(Arrays.asList(3, 3, 5), range);
	}

	@Test
	void testSeesOwnerMutations() {
		list.add(2, 2);
		Assertions.assertEquals(1, search.rank(n -> n.compareTo(2)));
		Assertions.assertEquals(2, search.find(n -> n.compareTo(2)));
	}
}
