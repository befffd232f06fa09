/**
 * Engine wiring and pluggable factories.
 *
 * <p>{@link com.mimecast.phishguard.main.Factories} holds the constructors of every external collaborator
 * <br>so tests and embedders can swap them.
 * <br>{@link com.mimecast.phishguard.main.Engines} builds the engines from configuration.
 */
package com.mimecast.phishguard.main;
