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
package com.tomaszrup.phpls.phpdoc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Structured content of a {@code /** ... *&#47;} comment.
 */
public final class PhpDoc {
	private final String summary;
	private final String description;
	private final List<Tag> tags;

	public PhpDoc(String summary, String description, List<Tag> tags) {
		this.summary = summary;
		this.description = description;
		this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
	}

	public String getSummary() {
		return summary;
	}

	public String getDescription() {
		return description;
	}

	public List<Tag> getTags() {
		return tags;
	}

	/**
	 * Summary and description joined by a blank line, or {@code null} if
	 * both are empty.
	 */
	public String getText() {
		if (summary.isEmpty() && description.isEmpty()) {
			return null;
		}
		if (description.isEmpty()) {
			return summary;
		}
		return summary.isEmpty() ? description : summary + "\n\n" + description;
	}

	public Tag findParamTag(String name) {
		for (Tag tag : tags) {
			if (Tag.PARAM.equals(tag.getTagName()) && name.equals(tag.getName())) {
				return tag;
			}
		}
		return null;
	}

	public Tag getReturnTag() {
		for (Tag tag : tags) {
			if (Tag.RETURN.equals(tag.getTagName())) {
				return tag;
			}
		}
		return null;
	}

	/**
	 * A {@code @var} tag naming {@code name}, or else the first unnamed one.
	 */
	public Tag findVarTag(String name) {
		Tag unnamed = null;
		for (Tag tag : tags) {
			if (!Tag.VAR.equals(tag.getTagName())) {
				continue;
			}
			if (name != null && name.equals(tag.getName())) {
				return tag;
			}
			if (unnamed == null && tag.getName().isEmpty()) {
				unnamed = tag;
			}
		}
		return unnamed;
	}

	public List<Tag> getMethodTags() {
		List<Tag> result = new ArrayList<>();
		for (Tag tag : tags) {
			if (Tag.METHOD.equals(tag.getTagName())) {
				result.add(tag);
			}
		}
		return result;
	}

	public List<Tag> getPropertyTags() {
		List<Tag> result = new ArrayList<>();
		for (Tag tag : tags) {
			if (tag.isPropertyTag()) {
				result.add(tag);
			}
		}
		return result;
	}
}
