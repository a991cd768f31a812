package com.conciliator.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import com.conciliator.engine.config.QualityScoreConfig;
import com.conciliator.engine.enums.ReconciliationStatus;
import com.conciliator.engine.services.statements.StatementEngine;
import com.conciliator.engine.services.statements.model.StatementRequest;
import com.conciliator.engine.services.statements.model.StatementResult;
import com.conciliator.engine.services.statements.rules.BankRuleProvider;

@SpringBootTest(properties = {
		"conciliator.quality.parallel-strategies=true"
})
class StatementEngineApplicationTests {

	@Autowired
	private BankRuleProvider ruleProvider;

	@Autowired
	private StatementEngine engine;

	@Autowired
	private QualityScoreConfig qualityConfig;

	@Test
	void contextLoads() {
		assertTrue(ruleProvider.knownKeys().contains("inbursa"));
		assertTrue(ruleProvider.knownKeys().contains("bbva"));
		assertTrue(qualityConfig.isParallelStrategies());
	}

	@Test
	void processesStatementWithBankOverrides() {
		String text = String.join("\n",
				"BBVA MEXICO",
				"ESTADO DE CUENTA",
				"PERIODO DEL 01/12/2024 AL 31/12/2024",
				"DIC 01 BALANCE INICIAL 10,000.00",
				"DIC 03 1234567890 SPEI RECIBIDO NOMINA 5,000.00 15,000.00",
				"DIC 04 OXXO SUC 123 150.00 14,850.00",
				"DIC 05 NETFLIX 219.00 14,631.00");

		StatementResult result = engine.process(StatementRequest.builder().text(text).build());

		assertEquals("bbva", result.getDiagnostics().getBankId());
		assertTrue(result.getDiagnostics().getRulesSource().startsWith("bbva"));
		assertEquals(3, result.getTransactions().size());
		assertEquals(ReconciliationStatus.OK, result.getSummary().getReconciliationStatus());
	}
}
