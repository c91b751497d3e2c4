package my.loancalculator.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;

@Entity
@Table(name = "comparison_scenarios")
public class ComparisonScenario {
	@Id
	@Column(name = "id", length = 64)
	private String id;

	@Column(name = "user_token", nullable = false, length = 64)
	private String userToken;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "summary_json", nullable = false, columnDefinition = "TEXT")
	private String summaryJson;

	@Column(name = "schedule_json", nullable = false, columnDefinition = "TEXT")
	private String scheduleJson;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	public String getUserToken() {
		return userToken;
	}

	public void setUserToken(String userToken) {
		this.userToken = userToken;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getSummaryJson() {
		return summaryJson;
	}

	public void setSummaryJson(String summaryJson) {
		this.summaryJson = summaryJson;
	}

	public String getScheduleJson() {
		return scheduleJson;
	}

	public void setScheduleJson(String scheduleJson) {
		this.scheduleJson = scheduleJson;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}
}
