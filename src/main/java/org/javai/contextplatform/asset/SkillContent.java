package org.javai.contextplatform.asset;

import java.util.List;

/**
 * A reusable analysis pattern.
 *
 * @param description what the skill achieves
 * @param steps ordered steps to follow
 * @param sqlTemplate optional parameterised SQL the skill is built around
 */
public record SkillContent(String description, List<String> steps, String sqlTemplate) implements AssetContent {

	public SkillContent {
		steps = steps == null ? List.of() : List.copyOf(steps);
	}

	@Override
	public AssetType assetType() {
		return AssetType.SKILL;
	}

	@Override
	public void validate() {
		if (AssetContent.isBlank(description)) {
			throw new InvalidAssetContentException(AssetType.SKILL, "description is required");
		}
		if (steps.isEmpty()) {
			throw new InvalidAssetContentException(AssetType.SKILL, "at least one step is required");
		}
	}

	@Override
	public String toText() {
		StringBuilder sb = new StringBuilder(description);
		for (int i = 0; i < steps.size(); i++) {
			sb.append("\n").append(i + 1).append(". ").append(steps.get(i));
		}
		if (!AssetContent.isBlank(sqlTemplate)) {
			sb.append("\nSQL: ").append(sqlTemplate);
		}
		return sb.toString();
	}
}
