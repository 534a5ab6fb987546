/**
 * HTTP surface: conversation endpoints, Server-Sent Events streaming and error mapping.
 */
package com.llmcouncil.presentation;
