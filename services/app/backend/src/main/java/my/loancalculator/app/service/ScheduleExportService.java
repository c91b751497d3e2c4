package my.loancalculator.app.service;

import my.loancalculator.app.dto.ScheduleEntryDto;
import my.loancalculator.app.model.ScheduleResult;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class ScheduleExportService {
	static final String[] CSV_HEADER = {
			"period_index", "month", "starting_balance", "payment", "principal_component", "interest_component",
			"overpayment_amount", "ending_balance", "tranche_disbursed_amount", "is_holiday"
	};

	private final ScheduleDtoMapper mapper;
	private final ObjectMapper objectMapper;

	public ScheduleExportService(ScheduleDtoMapper mapper, ObjectMapper objectMapper) {
		this.mapper = mapper;
		this.objectMapper = objectMapper;
	}

	public String export(ScheduleResult result, ExportFormat format) {
		return switch (format) {
			case CSV -> toCsv(result);
			case JSON -> toJson(result);
		};
	}

	public String toCsv(ScheduleResult result) {
		StringWriter out = new StringWriter();
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader(CSV_HEADER)
				.setRecordSeparator('\n')
				.get();
		try (CSVPrinter printer = new CSVPrinter(out, format)) {
			for (ScheduleEntryDto row : mapper.toEntryDtos(result.entries())) {
				printer.printRecord(
						row.periodIndex(),
						row.month(),
						row.startingBalance().toPlainString(),
						row.payment().toPlainString(),
						row.principalComponent().toPlainString(),
						row.interestComponent().toPlainString(),
						row.overpaymentAmount().toPlainString(),
						row.endingBalance().toPlainString(),
						row.trancheDisbursedAmount().toPlainString(),
						row.holiday()
				);
			}
		} catch (IOException ex) {
			throw new IllegalStateException("Failed to write schedule CSV", ex);
		}
		return out.toString();
	}

	public String toJson(ScheduleResult result) {
		Map<String, Object> payload = new LinkedHashMap<>();
		payload.put("summary", mapper.toSummaryDto(result.summary()));
		payload.put("schedule", mapper.toEntryDtos(result.entries()));
		try {
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
		} catch (JacksonException ex) {
			throw new IllegalStateException("Failed to write schedule JSON", ex);
		}
	}
}
