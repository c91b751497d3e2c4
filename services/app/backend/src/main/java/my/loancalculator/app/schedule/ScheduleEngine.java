package my.loancalculator.app.schedule;

import my.loancalculator.app.model.LoanConfiguration;
import my.loancalculator.app.model.LoanType;
import my.loancalculator.app.model.Overpayment;
import my.loancalculator.app.model.OverpaymentKind;
import my.loancalculator.app.model.ScheduleEntry;
import my.loancalculator.app.model.ScheduleResult;
import my.loancalculator.app.model.ScheduleSummary;
import my.loancalculator.app.model.Tranche;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Month-stepping amortization simulator.
 *
 * <p>A run first walks the months before {@code startMonth} in which tranches were already disbursed, capitalizing
 * their interest. It then simulates one entry per month: tranche release, holiday capitalization or a regular
 * payment with overpayments and target-payment reconciliation, followed by re-amortization where requested. The run
 * ends when the balance is settled; a forced payoff entry closes out a balance left after the term is used up.
 *
 * <p>Instances hold no per-run state and may be shared between threads.
 */
public class ScheduleEngine {
	public static final MathContext DEFAULT_MATH_CONTEXT = new MathContext(28, RoundingMode.HALF_EVEN);

	static final BigDecimal TERMINATION_EPSILON = new BigDecimal("0.01");
	static final BigDecimal DUST_THRESHOLD = new BigDecimal("0.005");

	private static final Logger logger = LoggerFactory.getLogger(ScheduleEngine.class);
	private static final BigDecimal ZERO = BigDecimal.ZERO;

	private final MathContext mathContext;
	private final PaymentFormulas formulas;
	private final ScheduleSummaryAggregator summaryAggregator;

	public ScheduleEngine() {
		this(DEFAULT_MATH_CONTEXT);
	}

	public ScheduleEngine(MathContext mathContext) {
		if (mathContext == null || mathContext.getPrecision() == 0) {
			throw new IllegalArgumentException("A bounded MathContext is required");
		}
		this.mathContext = mathContext;
		this.formulas = new PaymentFormulas(mathContext);
		this.summaryAggregator = new ScheduleSummaryAggregator(formulas);
	}

	public ScheduleResult simulate(LoanConfiguration config) {
		if (config == null) {
			throw new IllegalArgumentException("config must not be null");
		}
		BigDecimal monthlyRate = formulas.monthlyRate(config.rate());
		NavigableMap<YearMonth, BigDecimal> tranchePercents = indexTranches(config.tranches());
		Map<YearMonth, List<Overpayment>> overpaymentsByMonth = indexOverpayments(config.overpayments());

		SimulationState state = openingState(config, tranchePercents, monthlyRate);
		List<ScheduleEntry> entries = new ArrayList<>();
		long maxPeriods = 2L * config.term();
		boolean forcedPayoff = false;

		while (isOutstanding(state, tranchePercents) && state.periodIndex() <= maxPeriods) {
			BigDecimal startingBalance = state.balance();
			BigDecimal disbursed = releaseTranche(config, state, tranchePercents.get(state.month()));

			if (config.holidays().contains(state.month())) {
				entries.add(holidayEntry(state, startingBalance, disbursed, monthlyRate));
				state.advance();
				continue;
			}

			List<Overpayment> overpayments = overpaymentsByMonth.getOrDefault(state.month(), List.of());
			entries.add(paymentEntry(config, state, startingBalance, disbursed, overpayments, monthlyRate));
			state.advance();

			if (state.remainingTerm() <= 0 && state.balance().signum() > 0) {
				logger.debug("Term exhausted with {} outstanding, forcing payoff in {}",
						state.balance().toPlainString(), state.month());
				entries.add(forcedPayoffEntry(state, monthlyRate));
				forcedPayoff = true;
				break;
			}
		}

		if (!forcedPayoff) {
			if (isOutstanding(state, tranchePercents)) {
				logger.warn("Simulation stopped at the safety bound of {} periods with {} outstanding",
						maxPeriods, state.balance().toPlainString());
				throw new SimulationDivergenceException(state.periodIndex() - 1, state.month().minusMonths(1),
						state.balance());
			}
			if (state.balance().signum() > 0) {
				entries.add(forcedPayoffEntry(state, monthlyRate));
			}
		}

		logger.debug("Simulated {} periods, {} disbursed", entries.size(), state.disbursedPrincipal().toPlainString());
		ScheduleSummary summary = summaryAggregator.summarize(config, entries, monthlyRate);
		return new ScheduleResult(entries, summary);
	}

	private SimulationState openingState(LoanConfiguration config,
										 NavigableMap<YearMonth, BigDecimal> tranchePercents,
										 BigDecimal monthlyRate) {
		BigDecimal financed = config.financedPrincipal();
		if (tranchePercents.isEmpty()) {
			return new SimulationState(config.loanType(), formulas, monthlyRate,
					financed, BigDecimal.ONE, financed, config.term(), config.startMonth());
		}

		YearMonth cursor = tranchePercents.firstKey();
		if (config.startMonth().isBefore(cursor)) {
			cursor = config.startMonth();
		}
		BigDecimal percent = ZERO;
		BigDecimal disbursed = ZERO;
		BigDecimal capitalized = ZERO;
		while (cursor.isBefore(config.startMonth())) {
			BigDecimal target = tranchePercents.get(cursor);
			if (target != null && target.compareTo(percent) > 0) {
				disbursed = disbursed.add(financed.multiply(target.subtract(percent), mathContext));
				percent = target;
			}
			capitalized = capitalized.add(formulas.interest(disbursed, monthlyRate));
			cursor = cursor.plusMonths(1);
		}
		if (disbursed.signum() > 0) {
			logger.debug("Disbursed {} before {} with {} capitalized interest",
					disbursed.toPlainString(), config.startMonth(), capitalized.toPlainString());
		}
		return new SimulationState(config.loanType(), formulas, monthlyRate,
				disbursed.add(capitalized), percent, disbursed, config.term(), config.startMonth());
	}

	private BigDecimal releaseTranche(LoanConfiguration config, SimulationState state, BigDecimal targetPercent) {
		if (targetPercent == null || targetPercent.compareTo(state.currentPercent()) <= 0) {
			return ZERO;
		}
		BigDecimal additional = config.financedPrincipal()
				.multiply(targetPercent.subtract(state.currentPercent()), mathContext);
		state.disburse(additional, targetPercent);
		if (state.remainingTerm() > 0) {
			state.reamortize();
		}
		return additional;
	}

	private ScheduleEntry holidayEntry(SimulationState state,
									   BigDecimal startingBalance,
									   BigDecimal disbursed,
									   BigDecimal monthlyRate) {
		BigDecimal interest = formulas.interest(state.balance(), monthlyRate);
		state.capitalize(interest);
		return new ScheduleEntry(state.periodIndex(), state.month(), startingBalance,
				ZERO, ZERO, interest, ZERO, state.balance(), disbursed, true);
	}

	private ScheduleEntry paymentEntry(LoanConfiguration config,
									   SimulationState state,
									   BigDecimal startingBalance,
									   BigDecimal disbursed,
									   List<Overpayment> overpayments,
									   BigDecimal monthlyRate) {
		BigDecimal balance = state.balance();
		BigDecimal interest = formulas.interest(balance, monthlyRate);
		PeriodCashFlow flow;
		if (state.loanType() == LoanType.ANNUITY) {
			flow = new PeriodCashFlow(state.installment(), state.installment().subtract(interest));
		} else {
			flow = new PeriodCashFlow(state.principalComponent().add(interest), state.principalComponent());
		}

		boolean reamortize = false;
		BigDecimal explicitOverpayment = ZERO;
		for (Overpayment overpayment : overpayments) {
			explicitOverpayment = explicitOverpayment.add(overpayment.amount());
			if (overpayment.kind() == OverpaymentKind.INSTALLMENT) {
				reamortize = true;
			}
		}
		flow.addOverpayment(explicitOverpayment);

		if (config.targetPayment() != null) {
			BigDecimal slack = config.targetPayment().subtract(flow.payment.add(explicitOverpayment));
			if (slack.signum() > 0) {
				flow.addOverpayment(slack);
				reamortize = true;
			}
		}

		BigDecimal newBalance = balance.subtract(flow.principal);
		// Sub-cent residuals are settled in this entry, never in a payoff month of their own.
		if (newBalance.abs().compareTo(DUST_THRESHOLD) < 0
				|| (newBalance.signum() > 0 && newBalance.compareTo(TERMINATION_EPSILON) <= 0)) {
			flow.absorb(newBalance);
			newBalance = ZERO;
		}
		state.updateBalance(newBalance);

		if (reamortize && newBalance.signum() > 0 && state.remainingTerm() > 1) {
			state.decrementTerm();
			state.reamortize();
		} else {
			state.decrementTerm();
		}

		if (newBalance.signum() < 0) {
			flow.absorb(newBalance);
			state.updateBalance(ZERO);
		}

		return new ScheduleEntry(state.periodIndex(), state.month(), startingBalance,
				flow.payment, flow.principal, interest, flow.overpayment, state.balance(), disbursed, false);
	}

	private ScheduleEntry forcedPayoffEntry(SimulationState state, BigDecimal monthlyRate) {
		BigDecimal remaining = state.balance();
		BigDecimal interest = formulas.interest(remaining, monthlyRate);
		ScheduleEntry entry = new ScheduleEntry(state.periodIndex(), state.month(), remaining,
				remaining.add(interest), remaining, interest, ZERO, ZERO, ZERO, false);
		state.updateBalance(ZERO);
		state.advance();
		return entry;
	}

	private boolean isOutstanding(SimulationState state, NavigableMap<YearMonth, BigDecimal> tranchePercents) {
		if (state.balance().compareTo(TERMINATION_EPSILON) > 0) {
			return true;
		}
		return tranchePercents.tailMap(state.month(), true).values().stream()
				.anyMatch(percent -> percent.compareTo(state.currentPercent()) > 0);
	}

	private static NavigableMap<YearMonth, BigDecimal> indexTranches(List<Tranche> tranches) {
		NavigableMap<YearMonth, BigDecimal> index = new TreeMap<>();
		tranches.stream()
				.sorted(Comparator.comparing(Tranche::month))
				.forEach(tranche -> index.put(tranche.month(), tranche.cumulativePercent()));
		return index;
	}

	private static Map<YearMonth, List<Overpayment>> indexOverpayments(List<Overpayment> overpayments) {
		Map<YearMonth, List<Overpayment>> index = new HashMap<>();
		for (Overpayment overpayment : overpayments) {
			index.computeIfAbsent(overpayment.month(), key -> new ArrayList<>()).add(overpayment);
		}
		return index;
	}

	/**
	 * Cash amounts of one payment period. Residuals from dust suppression and overshoot correction are folded in so
	 * that {@code payment + overpayment == principal + interest} still holds.
	 */
	private static final class PeriodCashFlow {
		private BigDecimal payment;
		private BigDecimal principal;
		private BigDecimal overpayment = ZERO;

		private PeriodCashFlow(BigDecimal payment, BigDecimal principal) {
			this.payment = payment;
			this.principal = principal;
		}

		private void addOverpayment(BigDecimal amount) {
			overpayment = overpayment.add(amount);
			principal = principal.add(amount);
		}

		private void absorb(BigDecimal residual) {
			principal = principal.add(residual);
			if (residual.signum() >= 0) {
				payment = payment.add(residual);
				return;
			}
			BigDecimal excess = residual.negate();
			BigDecimal fromPayment = excess.min(payment.max(ZERO));
			payment = payment.subtract(fromPayment);
			overpayment = overpayment.subtract(excess.subtract(fromPayment));
		}
	}
}
