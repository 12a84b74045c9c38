package org.javai.contextplatform.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.javai.contextplatform.asset.TableDescriptionContent.ColumnDescription;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AssetContent")
class AssetContentTest {

	@Nested
	@DisplayName("validation")
	class Validation {

		@Test
		@DisplayName("glossary needs term and definition")
		void glossaryNeedsTermAndDefinition() {
			assertThatThrownBy(() -> new GlossaryContent("Revenue", " ").validate())
					.isInstanceOf(InvalidAssetContentException.class)
					.hasMessageContaining("definition");
			assertThatCode(() -> new GlossaryContent("Revenue", "Net order amount").validate())
					.doesNotThrowAnyException();
		}

		@Test
		@DisplayName("table description rejects duplicate column names ignoring case")
		void tableDescriptionRejectsDuplicateColumns() {
			TableDescriptionContent content = new TableDescriptionContent("orders", "One row per order", List.of(
					new ColumnDescription("amount", "numeric", "Net amount"),
					new ColumnDescription("AMOUNT", "numeric", "Again")));

			assertThatThrownBy(content::validate)
					.isInstanceOf(InvalidAssetContentException.class)
					.hasMessageContaining("duplicate column");
		}

		@Test
		@DisplayName("instruction and skill need their core fields")
		void instructionAndSkillNeedCoreFields() {
			assertThatThrownBy(() -> new InstructionContent("querying revenue", List.of()).validate())
					.isInstanceOf(InvalidAssetContentException.class);
			assertThatThrownBy(() -> new SkillContent(" ", List.of("step"), null).validate())
					.isInstanceOf(InvalidAssetContentException.class);
		}
	}

	@Nested
	@DisplayName("text rendering")
	class TextRendering {

		@Test
		@DisplayName("glossary text includes synonyms and SQL expression")
		void glossaryText() {
			GlossaryContent content = new GlossaryContent("Revenue", "Net order amount", List.of("sales", "turnover"),
					"SUM(amount)");

			assertThat(content.toText())
					.contains("Revenue: Net order amount")
					.contains("sales, turnover")
					.contains("SUM(amount)");
		}

		@Test
		@DisplayName("table text lists columns with types")
		void tableText() {
			TableDescriptionContent content = new TableDescriptionContent("orders", "Orders",
					List.of(new ColumnDescription("amount", "numeric", "Net amount")));

			assertThat(content.toText()).contains("orders: Orders").contains("- amount (numeric): Net amount");
		}
	}

	@Test
	@DisplayName("round-trips through JSON with its kind")
	void jsonCarriesKind() throws Exception {
		ObjectMapper mapper = new ObjectMapper();
		AssetContent content = new SkillContent("Monthly revenue", List.of("group by month", "sum amount"),
				"SELECT date_trunc('month', created_at), SUM(amount) FROM orders GROUP BY 1");

		String json = mapper.writeValueAsString(content);
		AssetContent read = mapper.readValue(json, AssetContent.class);

		assertThat(json).contains("\"kind\":\"skill\"");
		assertThat(read).isEqualTo(content);
	}
}
