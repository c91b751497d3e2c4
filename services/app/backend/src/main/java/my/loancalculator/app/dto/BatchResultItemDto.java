package my.loancalculator.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchResultItemDto(
		@JsonProperty("index") int index,
		@JsonProperty("summary") ScheduleSummaryDto summary,
		@JsonProperty("error") String error
) {
	public static BatchResultItemDto success(int index, ScheduleSummaryDto summary) {
		return new BatchResultItemDto(index, summary, null);
	}

	public static BatchResultItemDto failure(int index, String error) {
		return new BatchResultItemDto(index, null, error);
	}
}
