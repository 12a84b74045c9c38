package org.javai.contextplatform.asset;

import java.util.List;

/**
 * Domain-specific analysis rules that apply when a condition holds.
 *
 * @param condition when the rules apply, e.g. "questions about revenue"; may be blank for always
 * @param rules the rules themselves
 */
public record InstructionContent(String condition, List<String> rules) implements AssetContent {

	public InstructionContent {
		rules = rules == null ? List.of() : List.copyOf(rules);
	}

	@Override
	public AssetType assetType() {
		return AssetType.INSTRUCTION;
	}

	@Override
	public void validate() {
		if (rules.isEmpty() || rules.stream().allMatch(AssetContent::isBlank)) {
			throw new InvalidAssetContentException(AssetType.INSTRUCTION, "at least one rule is required");
		}
	}

	@Override
	public String toText() {
		String prefix = AssetContent.isBlank(condition) ? "Always" : "When " + condition;
		return prefix + ": " + String.join("; ", rules);
	}
}
