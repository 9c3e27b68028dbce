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
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.index;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Binary search over an externally owned, ascending sorted list. The list is
 * held by reference, so later insertions and removals by the owner are seen
 * by subsequent searches.
 *
 * <p>All probes take a comparison function that is applied to a list
 * element and returns a negative value if the element sorts before the
 * probe key, zero if it is equal and a positive value if it sorts after.</p>
 *
 * @param <T> the element type
 */
public class BinarySearch<T> {
	private final List<T> sortedList;

	public BinarySearch(List<T> sortedList) {
		this.sortedList = sortedList;
	}

	/**
	 * @return the element comparing equal to the probe, or {@code null}
	 */
	public T find(ToIntFunction<T> compare) {
		int rank = rank(compare);
		if (rank < sortedList.size() && compare.applyAsInt(sortedList.get(rank)) == 0) {
			return sortedList.get(rank);
		}
		return null;
	}

	/**
	 * Lower bound: the smallest index at which the probe could be inserted
	 * while keeping the list sorted.
	 */
	public int rank(ToIntFunction<T> compare) {
		return rank(compare, 0);
	}

	private int rank(ToIntFunction<T> compare, int from) {
		int low = from;
		int high = sortedList.size();
		while (low < high) {
			int mid = (low + high) >>> 1;
			if (compare.applyAsInt(sortedList.get(mid)) < 0) {
				low = mid + 1;
			} else {
				high = mid;
			}
		}
		return low;
	}

	/**
	 * Returns the contiguous run of elements starting at the lower bound of
	 * {@code compareLower} and ending before the lower bound of
	 * {@code compareUpper}. The second search starts at the first result.
	 * {@code compareUpper} must report every element inside the run as
	 * sorting before the probe and every element after it as not.
	 *
	 * @return a view of the backing list; copy it before mutating the owner
	 */
	public List<T> range(ToIntFunction<T> compareLower, ToIntFunction<T> compareUpper) {
		int lower = rank(compareLower);
		int upper = rank(compareUpper, lower);
		return sortedList.subList(lower, upper);
	}
}
