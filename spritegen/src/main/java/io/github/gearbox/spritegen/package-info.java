/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Command-line tools preparing GEARBox mod textures: entity pictures
 * (optionally composed into sprite sheets, with a matching shadow) and
 * multi-resolution icon atlases.
 *
 * @see  <a href="https://wiki.factorio.com/Prototype/Sprite">Sprite</a>
 *       <i>(Factorio Wiki)</i>
 */
package io.github.gearbox.spritegen;
