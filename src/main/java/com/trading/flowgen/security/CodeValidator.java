package com.trading.flowgen.security;

import com.trading.flowgen.api.ValidationStatus;
import com.trading.flowgen.codegen.CodeGenerationRecord;

import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import lombok.extern.log4j.Log4j2;

/**
 * Drives a generated record through its validation lifecycle.
 *
 * <pre>
 * PENDING --syntax fails--> SYNTAX_ERROR
 * PENDING --syntax ok, violations--> SECURITY_ERROR
 * PENDING --syntax ok, no violations--> VALID
 * </pre>
 *
 * Generated code that does not parse is a template bug and is logged with the
 * {@code TEMPLATE_BUG} marker.
 */
@Log4j2
public final class CodeValidator {
    public static final Marker TEMPLATE_BUG = MarkerManager.getMarker("TEMPLATE_BUG");

    private final SyntaxValidator syntaxValidator;
    private final SecurityValidator securityValidator;

    public CodeValidator(SecurityPolicy policy) {
        this(new SyntaxValidator(), new SecurityValidator(policy));
    }

    public CodeValidator(SyntaxValidator syntaxValidator, SecurityValidator securityValidator) {
        this.syntaxValidator = syntaxValidator;
        this.securityValidator = securityValidator;
    }

    public CodeCheck check(String code) {
        SyntaxCheckResult syntax = syntaxValidator.check(code);
        if (!syntax.isValid())
            return new CodeCheck(ValidationStatus.SYNTAX_ERROR, syntax, SecurityCheckResult.invalidSyntax());
        SecurityCheckResult security = securityValidator.check(syntax.tree());
        return new CodeCheck(security.isSafe() ? ValidationStatus.VALID : ValidationStatus.SECURITY_ERROR,
                syntax, security);
    }

    /**
     * @throws IllegalStateException if the record is not {@code PENDING}
     */
    public CodeGenerationRecord validate(CodeGenerationRecord record) {
        if (record.getValidationStatus() != ValidationStatus.PENDING)
            throw new IllegalStateException("Record " + record.getId() + " already validated: "
                    + record.getValidationStatus());

        CodeCheck check = check(record.getGeneratedCode());
        switch (check.status()) {
            case SYNTAX_ERROR -> {
                log.error(TEMPLATE_BUG, "Generated code for instance {} does not parse: {}",
                        record.getInstanceId(), check.syntax().errors());
                return record.markSyntaxError(check.syntax().errors(), check.security().violations());
            }
            case SECURITY_ERROR -> {
                log.warn("Generated code for instance {} rejected: {} security violation(s)",
                        record.getInstanceId(), check.security().violations().size());
                return record.markSecurityError(check.security().violations());
            }
            case VALID -> {
                log.info("Generated code for instance {} validated", record.getInstanceId());
                return record.markValid();
            }
            default -> throw new IllegalStateException("Unexpected check status " + check.status());
        }
    }
}
