/*
 * Copyright (c) 2025 SmartLists Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.smartlists.ruleengine.api;

import com.smartlists.ruleengine.api.exceptions.RuleDefinitionException;
import com.smartlists.ruleengine.api.model.SmartListDefinition;
import com.smartlists.ruleengine.runtime.model.CompiledListDefinition;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Contract for turning list definitions into validated, executable form.
 *
 * <p>Every definition error is reported here, before any item is processed:
 * unknown fields, operators not allowed for a field, malformed targets, invalid
 * regular expressions and options out of range.
 */
public interface IRuleCompiler {

    /**
     * Compiles an already deserialized definition.
     *
     * @param definition the definition (must not be null)
     * @return compiled definition
     * @throws RuleDefinitionException if the definition is invalid
     */
    CompiledListDefinition compile(SmartListDefinition definition) throws RuleDefinitionException;

    /**
     * Compiles a definition from its JSON text.
     *
     * @throws RuleDefinitionException if the JSON is malformed or the definition invalid
     */
    CompiledListDefinition compileJson(String json) throws RuleDefinitionException;

    /**
     * Compiles a definition from a JSON file.
     *
     * @throws IOException if the file cannot be read
     * @throws RuleDefinitionException if the definition is invalid
     */
    CompiledListDefinition compile(Path definitionPath) throws IOException, RuleDefinitionException;
}
