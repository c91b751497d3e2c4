package my.loancalculator.app.repository;

import my.loancalculator.app.domain.ComparisonScenario;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ComparisonScenarioRepository extends JpaRepository<ComparisonScenario, String> {
	List<ComparisonScenario> findByUserTokenOrderByCreatedAtAsc(String userToken);

	List<ComparisonScenario> findByUserTokenOrderByCreatedAtDesc(String userToken);

	Optional<ComparisonScenario> findFirstByUserTokenOrderByCreatedAtDesc(String userToken);

	Optional<ComparisonScenario> findByIdAndUserToken(String id, String userToken);

	@Modifying
	@Query("delete from ComparisonScenario s where s.userToken = :userToken")
	int deleteByUserToken(@Param("userToken") String userToken);
}
