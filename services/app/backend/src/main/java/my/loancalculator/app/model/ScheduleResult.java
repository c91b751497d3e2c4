package my.loancalculator.app.model;

import java.util.List;

public record ScheduleResult(List<ScheduleEntry> entries, ScheduleSummary summary) {
	public ScheduleResult {
		entries = entries == null ? List.of() : List.copyOf(entries);
	}

	public int periodCount() {
		return entries.size();
	}
}
